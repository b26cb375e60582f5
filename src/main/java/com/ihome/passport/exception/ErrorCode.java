package com.ihome.passport.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务错误码。
 * <p>
 * `errno` 为对外稳定的错误编号（与前端约定，"0" 表示成功），`httpStatus` 为对应的 HTTP 状态码。
 */
@Getter
public enum ErrorCode {

    INVALID_INPUT("4103", HttpStatus.BAD_REQUEST, "参数错误"),
    CODE_EXPIRED_OR_MISSING("4002", HttpStatus.BAD_REQUEST, "短信验证码失效"),
    CODE_MISMATCH("4004", HttpStatus.BAD_REQUEST, "短信验证码错误"),
    IDENTITY_ALREADY_EXISTS("4003", HttpStatus.CONFLICT, "手机号已存在"),
    STORAGE_ERROR("4001", HttpStatus.SERVICE_UNAVAILABLE, "数据存储异常，请稍后重试"),
    TOO_MANY_ATTEMPTS("4201", HttpStatus.TOO_MANY_REQUESTS, "错误次数太多，请稍后重试"),
    INVALID_CREDENTIALS("4106", HttpStatus.UNAUTHORIZED, "用户名或密码错误"),
    SESSION_NOT_FOUND("4101", HttpStatus.OK, "用户未登录"),
    INTERNAL_ERROR("4500", HttpStatus.INTERNAL_SERVER_ERROR, "服务异常，请稍后重试");

    private final String errno;
    private final HttpStatus httpStatus;
    private final String defaultMessage;

    ErrorCode(String errno, HttpStatus httpStatus, String defaultMessage) {
        this.errno = errno;
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }
}
