package com.careerhub.matchservice.games.careermatch.interfaces.ws;

import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher.MatchEventType;
import com.careerhub.matchservice.games.careermatch.interfaces.ws.dto.MatchMessages.ErrorPayload;
import com.careerhub.matchservice.games.careermatch.interfaces.ws.dto.MatchMessages.FlipCmd;
import com.careerhub.matchservice.games.careermatch.interfaces.ws.dto.MatchMessages.SyncCmd;
import com.careerhub.matchservice.games.careermatch.service.CareerMatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

import java.util.concurrent.CompletionException;

/**
 * 职业翻牌 WebSocket 控制器
 * ----------------------------------------
 *   /app/match.flip  翻牌；状态变化由状态机逐帧推送，这里只负责把错误回推给订阅者
 *   /app/match.sync  请求全量快照（冲突后重绘）
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class CareerMatchWsController {

    private final CareerMatchService matchService;
    private final GameEventPublisher publisher;

    @MessageMapping("/match.flip")
    public void flip(FlipCmd cmd) {
        try {
            matchService.flipCard(cmd.getSessionId(), cmd.getPosition(), cmd.getActorId())
                    .whenComplete((r, e) -> {
                        if (e != null) {
                            sendError(cmd.getSessionId(), unwrap(e));
                        }
                    });
        } catch (RuntimeException e) {
            sendError(cmd.getSessionId(), e);
        }
    }

    @MessageMapping("/match.sync")
    public void sync(SyncCmd cmd) {
        try {
            var state = matchService.getGameState(cmd.getSessionId());
            publisher.publishToSession(state.getRoom().getId(), cmd.getSessionId(), MatchEventType.SNAPSHOT, state);
        } catch (RuntimeException e) {
            sendError(cmd.getSessionId(), e);
        }
    }

    private void sendError(String sessionId, Throwable e) {
        String code = e instanceof CareerMatchException cme ? cme.getCode().name() : "INTERNAL_ERROR";
        if (!(e instanceof CareerMatchException)) {
            log.error("WS 翻牌失败: session={}", sessionId, e);
        }
        publisher.publishToSession(null, sessionId, MatchEventType.ERROR, new ErrorPayload(code, e.getMessage()));
    }

    private static Throwable unwrap(Throwable e) {
        return (e instanceof CompletionException && e.getCause() != null) ? e.getCause() : e;
    }
}
