package com.careerhub.matchservice.games.careermatch.application;

import com.careerhub.matchservice.games.careermatch.domain.event.SessionClosedEvent;
import com.careerhub.matchservice.games.careermatch.domain.event.SessionOpenedEvent;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.service.CareerMatchService;
import com.careerhub.matchservice.games.careermatch.service.GameCompletionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 房间循环编排：
 * - 新局出现第一位玩家后，等待补位时间，仍未开局则由 AI 补位开局；
 * - 对局结束后，局间休息到点把房间恢复为 ACTIVE。
 * 同一对局 / 房间只保留一个待执行任务。
 */
@Slf4j
@Component
public class RoomCycleCoordinator {

    /** 房间正忙时的重试间隔 */
    static final long RETRY_DELAY_MS = 500;

    private final CareerMatchService matchService;
    private final GameCompletionService completion;
    private final ScheduledExecutorService matchScheduler;
    private final Clock clock;

    private final ConcurrentMap<String, ScheduledFuture<?>> pendingFill = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ScheduledFuture<?>> pendingReopen = new ConcurrentHashMap<>();

    public RoomCycleCoordinator(@Lazy CareerMatchService matchService,
                                GameCompletionService completion,
                                @Qualifier("matchScheduler") ScheduledExecutorService matchScheduler,
                                Clock clock) {
        this.matchService = matchService;
        this.completion = completion;
        this.matchScheduler = matchScheduler;
        this.clock = clock;
    }

    @EventListener
    public void onSessionOpened(SessionOpenedEvent e) {
        long delay = Math.max(0, e.fillAtEpochMs() - clock.millis());
        replace(pendingFill, e.sessionId(),
                matchScheduler.schedule(() -> fillAndStart(e.sessionId()), delay, TimeUnit.MILLISECONDS));
        log.info("AI 补位计时: session={}, delayMs={}", e.sessionId(), delay);
    }

    @EventListener
    public void onSessionClosed(SessionClosedEvent e) {
        long delay = Math.max(0, e.nextGameStartsAt() - clock.millis());
        replace(pendingReopen, e.roomId(),
                matchScheduler.schedule(() -> reopen(e.roomId()), delay, TimeUnit.MILLISECONDS));
    }

    void fillAndStart(String sessionId) {
        pendingFill.remove(sessionId);
        try {
            matchService.startGameSession(sessionId);
        } catch (CareerMatchException ex) {
            if (ex.getCode() == ErrorCode.ROOM_BUSY) {
                replace(pendingFill, sessionId,
                        matchScheduler.schedule(() -> fillAndStart(sessionId), RETRY_DELAY_MS, TimeUnit.MILLISECONDS));
                return;
            }
            log.warn("AI 补位开局失败: session={}, code={}", sessionId, ex.getCode());
        } catch (RuntimeException ex) {
            log.error("AI 补位开局异常: session={}", sessionId, ex);
        }
    }

    void reopen(String roomId) {
        pendingReopen.remove(roomId);
        try {
            completion.reopenRoom(roomId);
        } catch (CareerMatchException ex) {
            if (ex.getCode() == ErrorCode.ROOM_BUSY) {
                replace(pendingReopen, roomId,
                        matchScheduler.schedule(() -> reopen(roomId), RETRY_DELAY_MS, TimeUnit.MILLISECONDS));
                return;
            }
            log.warn("房间恢复开放失败: room={}, code={}", roomId, ex.getCode());
        } catch (RuntimeException ex) {
            log.error("房间恢复开放失败: room={}", roomId, ex);
        }
    }

    private static void replace(ConcurrentMap<String, ScheduledFuture<?>> pending, String key, ScheduledFuture<?> task) {
        ScheduledFuture<?> old = pending.put(key, task);
        if (old != null && old != task) {
            old.cancel(false);
        }
    }
}
