package com.ihome.passport.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ihome.passport.exception.ErrorCode;

/**
 * 统一响应体：`errno` 为 "0" 表示成功，否则为 {@link ErrorCode#getErrno()}。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(String errno, String errmsg, T data) {

    public static final String OK = "0";

    public static <T> ApiResponse<T> ok(String errmsg) {
        return new ApiResponse<>(OK, errmsg, null);
    }

    public static <T> ApiResponse<T> ok(String errmsg, T data) {
        return new ApiResponse<>(OK, errmsg, data);
    }

    public static <T> ApiResponse<T> error(ErrorCode errorCode, String errmsg) {
        return new ApiResponse<>(errorCode.getErrno(), errmsg, null);
    }

    public static <T> ApiResponse<T> error(ErrorCode errorCode) {
        return error(errorCode, errorCode.getDefaultMessage());
    }
}
