package com.edtech.auth.exception;

import lombok.Getter;

/**
 * 认证领域异常。
 * <p>
 * 携带稳定的 {@link ErrorCode}，由 {@code GlobalExceptionHandler} 统一转换为 code/message 响应。
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
