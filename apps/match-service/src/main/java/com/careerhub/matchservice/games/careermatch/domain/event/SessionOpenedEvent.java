package com.careerhub.matchservice.games.careermatch.domain.event;

/**
 * 新局出现第一位玩家，等待补位。
 *
 * @param fillAtEpochMs 最早触发 AI 补位开局的时间
 */
public record SessionOpenedEvent(String roomId, String sessionId, long fillAtEpochMs) {
}
