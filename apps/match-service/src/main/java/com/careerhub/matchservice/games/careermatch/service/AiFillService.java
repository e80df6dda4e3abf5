package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.common.random.RandomSource;
import com.careerhub.matchservice.games.careermatch.domain.enums.AiFillPolicy;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.model.AiPersona;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.port.AiPersonaPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AI 补位：只负责挑选并让 AI 入座，不决定 AI 翻哪张牌。
 * 无论 neededCount 传多少，入座后人数都不会超过 room.maxPlayersPerGame。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiFillService {

    private final AiPersonaPool personaPool;
    private final ParticipantRegistry registry;
    private final RandomSource random;

    public List<Participant> fillSeats(GameSession session, PerpetualRoom room, int neededCount, AiFillPolicy policy) {
        List<Participant> seated = registry.listParticipants(session.getId());
        int allowed = Math.min(neededCount, room.getMaxPlayersPerGame() - seated.size());
        if (allowed <= 0) {
            return List.of();
        }
        // 已在本房间入座的 AI 不能再抽，避免同名 AI 同局出现两次
        Set<String> excluded = seated.stream()
                .map(Participant::getAiPersonaId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        List<AiPersona> drawn = personaPool.draw(allowed, excluded);
        if (drawn.size() < allowed) {
            log.warn("AI 人设池不足: session={}, need={}, got={}", session.getId(), allowed, drawn.size());
        }

        List<Participant> added = new ArrayList<>();
        for (AiPersona persona : drawn) {
            added.add(registry.addAiParticipant(session, persona, pickDifficulty(policy)));
        }
        registry.refreshOccupancy(session, room);
        log.info("AI 补位完成: session={}, added={}, policy={}", session.getId(), added.size(), policy);
        return added;
    }

    private Difficulty pickDifficulty(AiFillPolicy policy) {
        if (policy == null || policy == AiFillPolicy.MIXED) {
            Difficulty[] all = Difficulty.values();
            return all[random.nextInt(all.length)];
        }
        return policy.fixedDifficulty();
    }
}
