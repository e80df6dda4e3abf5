package com.careerhub.matchservice.games.careermatch.application;

import com.careerhub.matchservice.clock.scheduler.CountdownScheduler;
import com.careerhub.matchservice.games.careermatch.config.CareerMatchProperties;
import com.careerhub.matchservice.games.careermatch.domain.enums.TurnTimeoutMode;
import com.careerhub.matchservice.games.careermatch.domain.event.SessionClosedEvent;
import com.careerhub.matchservice.games.careermatch.domain.event.TurnStartedEvent;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher.MatchEventType;
import com.careerhub.matchservice.games.careermatch.service.CardMatchStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * TurnClockCoordinator
 * -------------------------------------------------
 * 把通用倒计时引擎与翻牌回合对接：
 * 1) 启动时注册 tick 监听，把每秒剩余时间推给对局订阅者；
 * 2) 每次回合开始（TurnStartedEvent）按房间的 turnTimeLimitSeconds 重新计时；
 * 3) 到期时：ADVISORY 模式只让倒计时归零；ENFORCED 模式调用状态机超时换人。
 *
 * 计时版本 = sessionId:turnNumber，回合号变了的计时器到期时直接作废。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnClockCoordinator {

    /** 超时处理撞上揭示续作时的重试间隔 */
    static final long RETRY_DELAY_MS = 1000;

    private final CountdownScheduler scheduler;
    private final CardMatchStateMachine stateMachine;
    private final GameEventPublisher publisher;
    private final CareerMatchProperties props;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("回合计时协调器启动: mode={}", props.getTurn().getTimeoutMode());
        scheduler.setTickListener((key, owner, deadlineMs, left) -> {
            String[] ids = parseKey(key);
            publisher.publishToSession(ids[0], ids[1], MatchEventType.TICK, Map.of(
                    "left", (int) left,
                    "participantId", owner,
                    "deadlineEpochMs", deadlineMs));
        });
    }

    @EventListener
    public void onTurnStarted(TurnStartedEvent e) {
        if (props.getTurn().getTimeoutMode() == TurnTimeoutMode.OFF || e.turnTimeLimitSeconds() <= 0) {
            return;
        }
        long deadline = e.turnStartedAt() + e.turnTimeLimitSeconds() * 1000L;
        scheduler.startOrResume(key(e.roomId(), e.sessionId()), e.participantId(), deadline,
                version(e.sessionId(), e.turnNumber()), this::handleTimeout);
    }

    @EventListener
    public void onSessionClosed(SessionClosedEvent e) {
        scheduler.stop(key(e.roomId(), e.sessionId()));
    }

    void handleTimeout(String key, String owner, String version) {
        if (props.getTurn().getTimeoutMode() != TurnTimeoutMode.ENFORCED) {
            return;
        }
        String sessionId = parseKey(key)[1];
        int turnNumber = Integer.parseInt(version.substring(version.lastIndexOf(':') + 1));
        try {
            stateMachine.expireTurn(sessionId, turnNumber);
        } catch (CareerMatchException ex) {
            if (ex.getCode() == ErrorCode.TURN_CONFLICT) {
                // 揭示续作持有对局锁，稍后再试；回合已变化时重试会被版本校验丢弃
                scheduler.startOrResume(key, owner, clock.millis() + RETRY_DELAY_MS, version, this::handleTimeout);
                return;
            }
            log.warn("回合超时处理失败: session={}, code={}", sessionId, ex.getCode());
        }
    }

    static String key(String roomId, String sessionId) {
        return "match:" + roomId + ":" + sessionId;
    }

    static String version(String sessionId, int turnNumber) {
        return sessionId + ":" + turnNumber;
    }

    /** key -> [roomId, sessionId] */
    static String[] parseKey(String key) {
        String[] parts = key.split(":", 3);
        return new String[]{parts[1], parts[2]};
    }
}
