package com.careerhub.matchservice.games.careermatch.domain.enums;

/** 单局状态 */
public enum SessionStatus {
    ACTIVE,
    COMPLETED
}
