package com.careerhub.matchservice.games.careermatch.infrastructure.client.xp.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * XP 账本：对局结果推送请求
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CareerMatchResultRequest {
    private String sessionId;
    private String roomId;
    private int gameNumber;
    private int durationSeconds;
    private long completedAt;
    private List<Standing> standings;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Standing {
        private String participantId;
        /** 真人用户ID；AI 为 null，账本忽略 AI 记录 */
        private String userId;
        private String displayName;
        private int rank;
        private int pairsMatched;
        private int arcadeXp;
        /** 已按 10:1 折算后的平台 XP */
        private int platformXp;
    }
}
