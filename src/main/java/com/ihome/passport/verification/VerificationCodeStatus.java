package com.ihome.passport.verification;

// 分别对应：成功、不存在或已过期、不匹配、存储不可用
public enum VerificationCodeStatus {
    SUCCESS,
    NOT_FOUND,
    MISMATCH,
    STORE_UNAVAILABLE
}
