package com.careerhub.matchservice.games.careermatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 翻牌审计记录：只追加，不修改，可用于回放。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Move {
    private String id;
    private String sessionId;
    private String participantId;
    private int turnNumber;
    /** 1 = 本回合第一翻，2 = 第二翻 */
    private int flipNumber;
    private int position;
    private String careerName;
    private String pairId;
    /** 第一翻为 null */
    private Boolean isMatch;
    private int xpEarned;
    private int streakCount;
    private long flippedAt;
}
