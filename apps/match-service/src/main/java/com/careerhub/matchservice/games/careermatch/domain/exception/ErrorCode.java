package com.careerhub.matchservice.games.careermatch.domain.exception;

import lombok.Getter;

/**
 * 翻牌游戏错误码。
 * category 决定客户端的处理方式：state 类刷新后重绘，conflict 类刷新后重试。
 */
@Getter
public enum ErrorCode {
    NO_ROOMS_AVAILABLE(Category.CONFIGURATION, 503),
    EMPTY_ROOM(Category.CONTRACT, 500),

    SESSION_NOT_ACTIVE(Category.STATE, 409),
    NOT_YOUR_TURN(Category.STATE, 409),
    CARD_ALREADY_MATCHED(Category.STATE, 409),
    CARD_ALREADY_REVEALED(Category.STATE, 409),
    SESSION_FULL(Category.STATE, 409),

    TURN_CONFLICT(Category.CONFLICT, 409),
    ROOM_BUSY(Category.CONFLICT, 409),

    ROOM_NOT_FOUND(Category.NOT_FOUND, 404),
    SESSION_NOT_FOUND(Category.NOT_FOUND, 404),
    CARD_NOT_FOUND(Category.NOT_FOUND, 404);

    public enum Category {
        CONFIGURATION,
        CONTRACT,
        STATE,
        CONFLICT,
        NOT_FOUND
    }

    private final Category category;
    private final int httpStatus;

    ErrorCode(Category category, int httpStatus) {
        this.category = category;
        this.httpStatus = httpStatus;
    }

    /** 并发冲突类错误，客户端拿到最新状态后可重试 */
    public boolean retryable() {
        return category == Category.CONFLICT;
    }
}
