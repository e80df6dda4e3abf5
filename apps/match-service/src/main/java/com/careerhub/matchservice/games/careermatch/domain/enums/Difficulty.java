package com.careerhub.matchservice.games.careermatch.domain.enums;

/**
 * 房间难度档位，同时也是 AI 参与者的单局难度。
 */
public enum Difficulty {
    EASY,
    MEDIUM,
    HARD
}
