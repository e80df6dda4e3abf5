package com.careerhub.matchservice.platform.events;

import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher;
import com.careerhub.matchservice.games.careermatch.interfaces.ws.dto.MatchMessages.BroadcastEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 通过 STOMP 简单代理推送对局事件：
 *   /topic/match.{sessionId}  对局内订阅
 *   /topic/room.{roomId}      房间（大厅）订阅
 * 推送失败只记日志。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompGameEventPublisher implements GameEventPublisher {

    private final SimpMessagingTemplate messaging;
    private final Clock clock;

    @Override
    public void publishToSession(String roomId, String sessionId, MatchEventType type, Object payload) {
        send(sessionTopic(sessionId), new BroadcastEvent(roomId, sessionId, type.name(), payload, clock.millis()));
    }

    @Override
    public void publishToRoom(String roomId, MatchEventType type, Object payload) {
        send(roomTopic(roomId), new BroadcastEvent(roomId, null, type.name(), payload, clock.millis()));
    }

    private void send(String destination, BroadcastEvent evt) {
        try {
            messaging.convertAndSend(destination, evt);
        } catch (MessagingException e) {
            log.warn("推送失败: dest={}, type={}", destination, evt.getType(), e);
        }
    }

    public static String sessionTopic(String sessionId) {
        return "/topic/match." + sessionId;
    }

    public static String roomTopic(String roomId) {
        return "/topic/room." + roomId;
    }
}
