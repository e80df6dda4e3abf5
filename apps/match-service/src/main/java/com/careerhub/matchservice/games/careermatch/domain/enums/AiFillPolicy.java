package com.careerhub.matchservice.games.careermatch.domain.enums;

/**
 * AI 补位难度策略：
 * MIXED 表示每个 AI 独立地从 EASY/MEDIUM/HARD 中均匀抽取；其余为固定难度。
 */
public enum AiFillPolicy {
    MIXED(null),
    EASY(Difficulty.EASY),
    MEDIUM(Difficulty.MEDIUM),
    HARD(Difficulty.HARD);

    private final Difficulty fixed;

    AiFillPolicy(Difficulty fixed) {
        this.fixed = fixed;
    }

    /** 固定难度；MIXED 返回 null */
    public Difficulty fixedDifficulty() {
        return fixed;
    }
}
