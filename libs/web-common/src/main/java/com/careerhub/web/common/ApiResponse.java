package com.careerhub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码（与 HTTP 状态一致）
     * 200: 成功
     * 400: 参数错误
     * 404: 资源不存在
     * 409: 业务状态冲突（非当前回合、卡牌已配对、并发冲突等）
     * 500: 服务器内部错误
     * 503: 服务配置缺失（如房间目录为空）
     */
    int code,

    /**
     * 响应消息（面向用户）
     */
    String message,

    /**
     * 机器可读的错误码，例如 NOT_YOUR_TURN；成功时为 null。
     * 客户端据此决定“刷新状态后重绘”还是“直接重试”。
     */
    String errorCode,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", null, data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, message, null, data);
    }

    /**
     * 失败响应（带错误码）
     */
    public static <T> ApiResponse<T> error(int code, String errorCode, String message) {
        return new ApiResponse<>(code, message, errorCode, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, "BAD_REQUEST", null);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, "CONFLICT", null);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, message, "INTERNAL_ERROR", null);
    }

    /**
     * 是否成功
     */
    public boolean isSuccess() {
        return code >= 200 && code < 300;
    }
}
