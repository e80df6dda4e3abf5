package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.domain.constants.GameMessages;
import com.careerhub.matchservice.games.careermatch.domain.enums.ConnectionStatus;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.enums.ParticipantType;
import com.careerhub.matchservice.games.careermatch.domain.model.AiPersona;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.repository.ParticipantStore;
import com.careerhub.matchservice.games.careermatch.domain.repository.RoomStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 参与者登记：真人入座（按 userId 幂等）、AI 入座、连接状态与房间在座人数维护。
 * 容量检查不在这里做，由调用方在入座 / 开局前负责。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParticipantRegistry {

    /** 轮转顺序：入座序号，其次入座时间 */
    public static final Comparator<Participant> JOIN_ORDER =
            Comparator.comparingInt(Participant::getJoinSequence).thenComparingLong(Participant::getJoinedAt);

    private final ParticipantStore participants;
    private final RoomStore rooms;
    private final Clock clock;

    /**
     * 真人入座。同一 (session, userId) 重复调用返回已有记录。
     */
    public Participant addUserParticipant(GameSession session, PerpetualRoom room, String userId, String displayName) {
        Optional<Participant> existing = participants.findByUser(session.getId(), userId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Participant p = newParticipant(session, ParticipantType.USER);
        p.setUserId(userId);
        p.setDisplayName(StringUtils.defaultIfBlank(displayName, GameMessages.DEFAULT_DISPLAY_NAME));
        participants.save(p);
        refreshOccupancy(session, room);
        log.info("玩家入座: session={}, userId={}, participant={}", session.getId(), userId, p.getId());
        return p;
    }

    /**
     * AI 入座（不刷新房间人数，由补位方批量完成后统一刷新）。
     */
    public Participant addAiParticipant(GameSession session, AiPersona persona, Difficulty difficulty) {
        Participant p = newParticipant(session, ParticipantType.AI_AGENT);
        p.setAiPersonaId(persona.getId());
        p.setDisplayName(persona.getDisplayName());
        p.setAiDifficulty(difficulty);
        p.setAiPersonality(StringUtils.defaultIfBlank(persona.getPersonality(), "friendly"));
        participants.save(p);
        return p;
    }

    /**
     * 按入座顺序列出本局参与者
     */
    public List<Participant> listParticipants(String sessionId) {
        return participants.findBySession(sessionId).stream()
                .sorted(JOIN_ORDER)
                .toList();
    }

    public Optional<Participant> findUser(String sessionId, String userId) {
        return participants.findByUser(sessionId, userId);
    }

    /**
     * 房主：最早入座的真人
     */
    public Optional<Participant> findHost(String sessionId) {
        return listParticipants(sessionId).stream()
                .filter(p -> p.getParticipantType() == ParticipantType.USER)
                .findFirst();
    }

    /**
     * 仅记录连接状态，不影响回合。
     * @return 更新后的参与者；不存在则 empty
     */
    public Optional<Participant> updateConnectionStatus(String sessionId, String userId, ConnectionStatus status) {
        Optional<Participant> found = participants.findByUser(sessionId, userId);
        found.ifPresent(p -> {
            p.setConnectionStatus(status);
            participants.save(p);
        });
        return found;
    }

    /**
     * 以本局实际人数刷新房间在座人数与峰值。
     * 重新读取房间后只改人数字段，不覆盖其它流程写入的状态与统计；传入的 room 同步更新。
     */
    public void refreshOccupancy(GameSession session, PerpetualRoom room) {
        int count = participants.findBySession(session.getId()).size();
        PerpetualRoom fresh = rooms.find(session.getRoomId()).orElse(room);
        fresh.setCurrentPlayerCount(count);
        fresh.setPeakConcurrentPlayers(Math.max(fresh.getPeakConcurrentPlayers(), count));
        fresh.setUpdatedAt(clock.millis());
        rooms.save(fresh);
        if (fresh != room) {
            room.setCurrentPlayerCount(fresh.getCurrentPlayerCount());
            room.setPeakConcurrentPlayers(fresh.getPeakConcurrentPlayers());
            room.setUpdatedAt(fresh.getUpdatedAt());
        }
    }

    private Participant newParticipant(GameSession session, ParticipantType type) {
        Participant p = new Participant();
        p.setId(UUID.randomUUID().toString());
        p.setSessionId(session.getId());
        p.setParticipantType(type);
        p.setConnectionStatus(ConnectionStatus.CONNECTED);
        p.setActive(true);
        p.setJoinedAt(clock.millis());
        p.setJoinSequence(participants.findBySession(session.getId()).size() + 1);
        return p;
    }
}
