package com.ihome.passport.exception;

import lombok.Getter;

/**
 * 业务异常，携带 {@link ErrorCode}，由 {@code GlobalExceptionHandler} 转为 `{errno, errmsg}` 响应。
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
