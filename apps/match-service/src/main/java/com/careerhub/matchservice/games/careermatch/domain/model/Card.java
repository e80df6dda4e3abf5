package com.careerhub.matchservice.games.careermatch.domain.model;

import com.careerhub.matchservice.games.careermatch.domain.enums.MatchState;
import lombok.Data;

/**
 * 对局中的一张牌。matched 一旦为 true，本局内不再变化。
 */
@Data
public class Card {
    private String sessionId;
    /** 槽位（0 起） */
    private int position;
    /** 同一 pairId 恰好出现两次 */
    private String pairId;
    private String careerName;
    private String careerImagePath;

    /** null = 背面朝上 */
    private MatchState matchState;
    private boolean matched;
    private String matchedBy;
    private Long matchedAt;

    /** 发牌动画的错峰延迟 */
    private int flipDelayMs;

    public boolean faceDown() {
        return matchState == null && !matched;
    }
}
