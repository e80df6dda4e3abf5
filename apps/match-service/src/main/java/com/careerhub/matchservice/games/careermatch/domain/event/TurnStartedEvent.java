package com.careerhub.matchservice.games.careermatch.domain.event;

/**
 * 回合开始（开局第一回合或换人）。
 */
public record TurnStartedEvent(String roomId,
                               String sessionId,
                               String participantId,
                               int turnNumber,
                               long turnStartedAt,
                               int turnTimeLimitSeconds) {
}
