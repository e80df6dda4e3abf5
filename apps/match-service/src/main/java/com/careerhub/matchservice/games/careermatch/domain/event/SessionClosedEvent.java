package com.careerhub.matchservice.games.careermatch.domain.event;

/**
 * 对局结束，房间进入局间休息。
 */
public record SessionClosedEvent(String roomId, String sessionId, long nextGameStartsAt) {
}
