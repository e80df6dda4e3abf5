package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.domain.dto.CareerMatchResult;
import com.careerhub.matchservice.games.careermatch.domain.enums.RoomStatus;
import com.careerhub.matchservice.games.careermatch.domain.enums.SessionStatus;
import com.careerhub.matchservice.games.careermatch.domain.event.SessionClosedEvent;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.model.WinnerEntry;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher.MatchEventType;
import com.careerhub.matchservice.games.careermatch.domain.port.XpLedger;
import com.careerhub.matchservice.games.careermatch.domain.repository.RoomStore;
import com.careerhub.matchservice.games.careermatch.domain.repository.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 对局结算：排名、落库、房间进入局间休息、推送 XP 账本。
 * 房间记录只在房间锁内读改写；账本推送交给 xpLedgerExecutor 异步执行，失败只记日志，已完成的对局不回滚。
 */
@Slf4j
@Service
public class GameCompletionService {

    /** 配对数降序，其次平台 XP 降序，再按入座顺序稳定 */
    static final Comparator<Participant> STANDING =
            Comparator.comparingInt(Participant::getPairsMatched).reversed()
                    .thenComparing(Comparator.comparingInt(Participant::getTotalXp).reversed())
                    .thenComparing(ParticipantRegistry.JOIN_ORDER);

    private final SessionManager sessionManager;
    private final RoomStore rooms;
    private final SessionStore sessions;
    private final ParticipantRegistry registry;
    private final TurnEngine turnEngine;
    private final MatchLocks locks;
    private final XpLedger xpLedger;
    private final Executor xpLedgerExecutor;
    private final GameEventPublisher publisher;
    private final ApplicationEventPublisher domainEvents;
    private final Clock clock;

    public GameCompletionService(SessionManager sessionManager,
                                 RoomStore rooms,
                                 SessionStore sessions,
                                 ParticipantRegistry registry,
                                 TurnEngine turnEngine,
                                 MatchLocks locks,
                                 XpLedger xpLedger,
                                 @Qualifier("xpLedgerExecutor") Executor xpLedgerExecutor,
                                 GameEventPublisher publisher,
                                 ApplicationEventPublisher domainEvents,
                                 Clock clock) {
        this.sessionManager = sessionManager;
        this.rooms = rooms;
        this.sessions = sessions;
        this.registry = registry;
        this.turnEngine = turnEngine;
        this.locks = locks;
        this.xpLedger = xpLedger;
        this.xpLedgerExecutor = xpLedgerExecutor;
        this.publisher = publisher;
        this.domainEvents = domainEvents;
        this.clock = clock;
    }

    /**
     * 结算一局（pairsRemaining 已归零）。调用方持有对局锁，本方法再等待房间锁，
     * 保证对局状态切换与房间进入局间休息不会和入座交错。
     * @return 排名
     */
    public List<WinnerEntry> completeGame(GameSession session) {
        String roomToken = locks.awaitRoom(session.getRoomId());
        List<WinnerEntry> winners;
        CareerMatchResult result;
        PerpetualRoom room;
        long nextGameStartsAt;
        try {
            long now = clock.millis();
            winners = rank(registry.listParticipants(session.getId()));

            turnEngine.releaseTurn(session);
            session.setWinners(winners);
            session.setStatus(SessionStatus.COMPLETED);
            session.setCompletedAt(now);
            int duration = session.getStartedAt() == null ? 0 : (int) ((now - session.getStartedAt()) / 1000);
            session.setDurationSeconds(duration);
            sessionManager.persist(session);

            room = sessionManager.requireRoom(session.getRoomId());
            nextGameStartsAt = now + room.getIntermissionDurationSeconds() * 1000L;
            int played = room.getTotalGamesPlayed();
            room.setAvgGameDurationSeconds((room.getAvgGameDurationSeconds() * played + duration) / (played + 1));
            room.setTotalGamesPlayed(played + 1);
            room.setTotalMatchesMade(room.getTotalMatchesMade() + session.getTotalPairs());
            room.setStatus(RoomStatus.INTERMISSION);
            room.setNextGameStartsAt(nextGameStartsAt);
            room.setUpdatedAt(now);
            rooms.save(room);
            result = new CareerMatchResult(session.getId(), room.getId(), session.getGameNumber(), duration, now, winners);
            log.info("对局结束: session={}, duration={}s, winner={}", session.getId(), duration,
                    winners.isEmpty() ? null : winners.get(0).getDisplayName());
        } finally {
            locks.unlockRoom(session.getRoomId(), roomToken);
        }

        publisher.publishToSession(room.getId(), session.getId(), MatchEventType.GAME_COMPLETED, session);
        publisher.publishToRoom(room.getId(), MatchEventType.ROOM_INTERMISSION, room);
        domainEvents.publishEvent(new SessionClosedEvent(room.getId(), session.getId(), nextGameStartsAt));
        postResults(result);
        return winners;
    }

    /**
     * 账本推送不占用揭示调度线程，也不占用对局锁。
     */
    private void postResults(CareerMatchResult result) {
        try {
            xpLedgerExecutor.execute(() -> {
                try {
                    xpLedger.postResults(result);
                } catch (Exception e) {
                    log.error("XP 账本推送失败（对局已结算，不回滚）: session={}", result.sessionId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("XP 账本推送被拒绝: session={}", result.sessionId(), e);
        }
    }

    /**
     * 排名：名次 1..N 连续不跳号。
     */
    public List<WinnerEntry> rank(List<Participant> roster) {
        List<Participant> sorted = new ArrayList<>(roster);
        sorted.sort(STANDING);
        List<WinnerEntry> out = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            Participant p = sorted.get(i);
            out.add(new WinnerEntry(p.getId(), p.getDisplayName(), p.getParticipantType(), p.getUserId(),
                    p.getPairsMatched(), p.getTotalXp(), p.getArcadeXp(), i + 1));
        }
        return out;
    }

    /**
     * 局间休息结束：房间恢复 ACTIVE。若此时还没有新局，在座人数清零。
     * @return true 表示本次确实发生了状态切换
     */
    public boolean reopenRoom(String roomId) {
        String token = locks.lockRoom(roomId);
        try {
            return reopenLocked(roomId);
        } finally {
            locks.unlockRoom(roomId, token);
        }
    }

    private boolean reopenLocked(String roomId) {
        PerpetualRoom room = sessionManager.requireRoom(roomId);
        if (room.getStatus() != RoomStatus.INTERMISSION) {
            return false;
        }
        boolean idle = room.getCurrentGameId() == null || sessions.find(room.getCurrentGameId())
                .map(s -> s.getStatus() == SessionStatus.COMPLETED)
                .orElse(true);
        if (idle) {
            room.setCurrentPlayerCount(0);
        }
        room.setStatus(RoomStatus.ACTIVE);
        room.setNextGameStartsAt(null);
        room.setUpdatedAt(clock.millis());
        rooms.save(room);
        log.info("房间恢复开放: room={}", room.getRoomCode());
        publisher.publishToRoom(roomId, MatchEventType.ROOM_REOPENED, room);
        return true;
    }
}
