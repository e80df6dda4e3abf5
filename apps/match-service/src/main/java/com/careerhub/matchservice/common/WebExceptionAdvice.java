package com.careerhub.matchservice.common;

import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.CompletionException;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 业务异常：按错误码映射 HTTP 状态。
     * 配置错误 503、契约违规 500、状态 / 冲突 409、不存在 404。
     */
    @ExceptionHandler(CareerMatchException.class)
    public ResponseEntity<ApiResponse<Object>> matchError(CareerMatchException e) {
        ErrorCode code = e.getCode();
        if (code.getCategory() == ErrorCode.Category.CONTRACT) {
            log.error("契约违规: {}", e.getMessage(), e);
        }
        return ResponseEntity.status(code.getHttpStatus())
                .body(ApiResponse.error(code.getHttpStatus(), code.name(), e.getMessage()));
    }

    /**
     * 异步翻牌失败：解包后按原异常处理。
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ApiResponse<Object>> completion(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof CareerMatchException cme) {
            return matchError(cme);
        }
        log.error("异步处理失败", e);
        return ResponseEntity.internalServerError().body(ApiResponse.serverError("服务器内部错误"));
    }

    /**
     * 参数不合法 → 400
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 业务状态不符合预期 → 409
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(409).body(ApiResponse.conflict(e.getMessage()));
    }
}
