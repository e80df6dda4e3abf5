package com.careerhub.matchservice.games.careermatch.domain.dto;

import com.careerhub.matchservice.games.careermatch.domain.model.WinnerEntry;

import java.util.List;

/**
 * 推送给平台 XP 账本的对局结果。
 */
public record CareerMatchResult(
        String sessionId,
        String roomId,
        int gameNumber,
        int durationSeconds,
        long completedAt,
        List<WinnerEntry> standings) {
}
