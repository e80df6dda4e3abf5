package com.careerhub.matchservice.games.careermatch.domain.dto;

/**
 * 单次配对的得分结果。
 *
 * @param arcadeXp   局内 XP（含连击奖励）
 * @param platformXp 折算后的平台 XP（向下取整）
 * @param streak     配对后的连击数
 */
public record MatchAward(int arcadeXp, int platformXp, int streak) {
}
