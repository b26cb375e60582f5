package com.ihome.passport.verification;

/**
 * 验证码校验结果。
 * <p>
 * 包含状态（成功/不存在或已过期/错误/存储不可用），提供便捷成功判断。
 */
public record VerificationCheckResult(VerificationCodeStatus status) {

    public static final VerificationCheckResult SUCCESS = new VerificationCheckResult(VerificationCodeStatus.SUCCESS);
    public static final VerificationCheckResult NOT_FOUND = new VerificationCheckResult(VerificationCodeStatus.NOT_FOUND);
    public static final VerificationCheckResult MISMATCH = new VerificationCheckResult(VerificationCodeStatus.MISMATCH);
    public static final VerificationCheckResult STORE_UNAVAILABLE = new VerificationCheckResult(VerificationCodeStatus.STORE_UNAVAILABLE);

    public boolean isSuccess() {
        return status == VerificationCodeStatus.SUCCESS;
    }
}
