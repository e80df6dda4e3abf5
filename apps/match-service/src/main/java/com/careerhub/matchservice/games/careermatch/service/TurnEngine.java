package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.domain.constants.GameMessages;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.repository.ParticipantStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * 回合引擎：校验回合归属、按入座顺序严格轮转、清理回合内的临时标记。
 * <p>
 * 所有方法只修改传入的 session 对象，由调用方在持有对局锁的前提下统一保存。
 */
@Service
@RequiredArgsConstructor
public class TurnEngine {

    private final ParticipantStore participants;
    private final ParticipantRegistry registry;
    private final Clock clock;

    /**
     * 校验请求方是否为当前回合持有者。
     * @param actorId 参与者ID，或真人的 userId
     * @return 回合持有者
     */
    public Participant requireTurnHolder(GameSession session, String actorId) {
        String holderId = session.getCurrentTurnPlayerId();
        if (holderId == null) {
            throw CareerMatchException.of(ErrorCode.NOT_YOUR_TURN, GameMessages.formatNotYourTurn(null));
        }
        Participant holder = participants.find(session.getId(), holderId)
                .orElseThrow(() -> CareerMatchException.of(ErrorCode.NOT_YOUR_TURN, GameMessages.formatNotYourTurn(holderId)));
        if (!holder.identifiedBy(actorId)) {
            throw CareerMatchException.of(ErrorCode.NOT_YOUR_TURN, GameMessages.formatNotYourTurn(holder.getDisplayName()));
        }
        return holder;
    }

    /**
     * 开局：指定第一回合持有者，回合号置 1。
     */
    public void assignFirstTurn(GameSession session, List<Participant> roster, Participant first) {
        long now = clock.millis();
        for (Participant p : roster) {
            boolean holder = p.getId().equals(first.getId());
            if (holder) {
                p.setTurnsTaken(p.getTurnsTaken() + 1);
                p.setTurnStartedAt(now);
            }
            if (holder || p.isActiveTurn()) {
                p.setActiveTurn(holder);
                participants.save(p);
            }
        }
        session.setCurrentTurnPlayerId(first.getId());
        session.setCurrentTurnNumber(1);
        session.setTotalTurns(1);
        clearFlips(session);
    }

    /**
     * 轮到下一位：(当前下标 + 1) mod 人数。
     * @return 新的回合持有者
     */
    public Participant advanceTurn(GameSession session) {
        List<Participant> roster = registry.listParticipants(session.getId()).stream()
                .filter(Participant::isActive)
                .toList();
        if (roster.isEmpty()) {
            throw CareerMatchException.of(ErrorCode.EMPTY_ROOM, GameMessages.EMPTY_ROOM);
        }
        int idx = -1;
        for (int i = 0; i < roster.size(); i++) {
            if (roster.get(i).getId().equals(session.getCurrentTurnPlayerId())) {
                idx = i;
                break;
            }
        }
        Participant next = roster.get((idx + 1) % roster.size());
        long now = clock.millis();
        for (Participant p : roster) {
            boolean holder = p == next;
            if (holder) {
                p.setTurnsTaken(p.getTurnsTaken() + 1);
                p.setTurnStartedAt(now);
            }
            if (holder || p.isActiveTurn()) {
                p.setActiveTurn(holder);
                participants.save(p);
            }
        }
        session.setCurrentTurnPlayerId(next.getId());
        session.setCurrentTurnNumber(session.getCurrentTurnNumber() + 1);
        session.setTotalTurns(session.getTotalTurns() + 1);
        clearFlips(session);
        return next;
    }

    /**
     * 结束时收回回合
     */
    public void releaseTurn(GameSession session) {
        for (Participant p : participants.findBySession(session.getId())) {
            if (p.isActiveTurn()) {
                p.setActiveTurn(false);
                participants.save(p);
            }
        }
        session.setCurrentTurnPlayerId(null);
        clearFlips(session);
    }

    public void clearFlips(GameSession session) {
        session.setFirstCardFlipped(null);
        session.setFirstCardFlippedAt(null);
        session.setSecondCardFlipped(null);
    }
}
