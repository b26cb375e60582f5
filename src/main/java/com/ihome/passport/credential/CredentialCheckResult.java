package com.ihome.passport.credential;

/**
 * 凭证校验结果。
 * <p>
 * 未注册账号与密码错误统一为 {@link CredentialStatus#INVALID_CREDENTIALS}，不携带任何可区分的信息。
 */
public record CredentialCheckResult(CredentialStatus status, AuthenticatedPrincipal principal) {

    public static final CredentialCheckResult INVALID = new CredentialCheckResult(CredentialStatus.INVALID_CREDENTIALS, null);
    public static final CredentialCheckResult STORE_UNAVAILABLE = new CredentialCheckResult(CredentialStatus.STORE_UNAVAILABLE, null);

    public static CredentialCheckResult authenticated(AuthenticatedPrincipal principal) {
        return new CredentialCheckResult(CredentialStatus.AUTHENTICATED, principal);
    }
}
