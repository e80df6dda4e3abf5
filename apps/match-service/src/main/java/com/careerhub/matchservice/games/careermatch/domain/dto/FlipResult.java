package com.careerhub.matchservice.games.careermatch.domain.dto;

import com.careerhub.matchservice.games.careermatch.domain.model.Card;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一次翻牌的结果。
 * 第一翻：isMatch = null；第二翻：揭示结束后给出配对结论。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlipResult {
    private Card card;
    private boolean firstFlip;
    private Boolean isMatch;
    /** 配对成功时的两张牌位置 */
    private List<Integer> matchedPair;
    /** 下一回合持有者；配对成功时仍是自己 */
    private String nextTurnPlayerId;
    private int xpEarned;
    private int streak;
    private int pairsRemaining;
    private boolean gameCompleted;
}
