package com.careerhub.matchservice.games.careermatch.domain.enums;

/**
 * 回合时限的处理方式。
 * OFF：不计时；ADVISORY：只广播倒计时；ENFORCED：到期自动换人。
 */
public enum TurnTimeoutMode {
    OFF,
    ADVISORY,
    ENFORCED
}
