package com.careerhub.matchservice.games.careermatch.domain.enums;

/**
 * 卡牌翻开状态（null 表示背面朝上）。
 * <ul>
 *   <li>M1：已翻开，尚未确认</li>
 *   <li>M2：已判定配对，待提交</li>
 *   <li>M3：配对已提交，永久翻开</li>
 * </ul>
 * 状态在一个回合内只能前进，或从 M1 退回 null。
 */
public enum MatchState {
    M1,
    M2,
    M3
}
