package com.careerhub.matchservice.games.careermatch.domain.exception;

import lombok.Getter;

/**
 * 翻牌游戏业务异常，携带 {@link ErrorCode}，由 WebExceptionAdvice 统一映射为 HTTP 状态。
 */
@Getter
public class CareerMatchException extends RuntimeException {

    private final ErrorCode code;

    public CareerMatchException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static CareerMatchException of(ErrorCode code, String message) {
        return new CareerMatchException(code, message);
    }
}
