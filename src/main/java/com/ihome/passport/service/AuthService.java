package com.ihome.passport.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import com.ihome.passport.api.dto.LoginRequest;
import com.ihome.passport.api.dto.RegisterRequest;
import com.ihome.passport.credential.AuthenticatedPrincipal;
import com.ihome.passport.credential.CredentialCheckResult;
import com.ihome.passport.credential.CredentialValidator;
import com.ihome.passport.exception.BusinessException;
import com.ihome.passport.exception.ErrorCode;
import com.ihome.passport.model.ClientInfo;
import com.ihome.passport.ratelimit.AttemptLimiter;
import com.ihome.passport.session.SessionContext;
import com.ihome.passport.session.SessionManager;
import com.ihome.passport.session.SessionToken;
import com.ihome.passport.session.SessionView;
import com.ihome.passport.user.User;
import com.ihome.passport.user.UserService;
import com.ihome.passport.util.IdentifierValidator;
import com.ihome.passport.verification.VerificationCheckResult;
import com.ihome.passport.verification.VerificationCodeLedger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 通行证业务服务。
 * <p>
 * 职责：短信验证码注册、手机号密码登录、查询登录状态、登出。
 * 安全策略：
 * - 手机号格式校验；
 * - 注册验证码一次性消费（先删后比）；
 * - 按客户端 IP 统计登录失败次数，超限后在窗口期内拒绝登录，计数存储故障时放行；
 * - 账号不存在与密码错误返回同一错误，不暴露手机号是否已注册。
 * 会话：成功注册/登录后通过 {@link SessionManager} 写入调用方传入的会话上下文。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserService userService;
    private final VerificationCodeLedger verificationCodeLedger;
    private final AttemptLimiter attemptLimiter;
    private final CredentialValidator credentialValidator;
    private final SessionManager sessionManager;
    private final PasswordEncoder passwordEncoder;
    private final IdentifierValidator identifierValidator;

    public SessionToken register(RegisterRequest request, ClientInfo clientInfo, SessionContext session) {
        if (!StringUtils.hasText(request.mobile()) || !StringUtils.hasText(request.smsCode())
                || !StringUtils.hasText(request.password()) || !StringUtils.hasText(request.password2())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "参数不完整");
        }
        String mobile = request.mobile();
        if (!identifierValidator.isValidMobile(mobile)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "手机号格式错误");
        }
        if (!request.password().equals(request.password2())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "两次密码不一致");
        }

        ensureVerificationSuccess(verificationCodeLedger.consume(mobile, request.smsCode()));

        User user = User.builder()
                .name(mobile)
                .mobile(mobile)
                .passwordHash(passwordEncoder.encode(request.password()))
                .build();
        try {
            userService.createUser(user);
        } catch (DuplicateKeyException ex) {
            log.info("Register rejected, mobile already exists mobile={} ip={}", mobile, clientInfo.ip());
            throw new BusinessException(ErrorCode.IDENTITY_ALREADY_EXISTS);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Failed to persist new user mobile={}", mobile, ex);
            throw new BusinessException(ErrorCode.STORAGE_ERROR);
        }

        SessionToken token = sessionManager.establish(session,
                new AuthenticatedPrincipal(user.getId(), user.getName(), user.getMobile()));
        log.info("Registered userId={} mobile={} ip={}", user.getId(), mobile, clientInfo.ip());
        return token;
    }

    public SessionToken login(LoginRequest request, ClientInfo clientInfo, SessionContext session) {
        if (!StringUtils.hasText(request.mobile()) || !StringUtils.hasText(request.password())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "参数不完整");
        }
        String mobile = request.mobile();
        if (!identifierValidator.isValidMobile(mobile)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "手机号格式不正确");
        }

        String clientKey = clientInfo.ip();
        if (attemptLimiter.isBlocked(clientKey)) {
            log.info("Login blocked ip={}", clientKey);
            throw new BusinessException(ErrorCode.TOO_MANY_ATTEMPTS);
        }

        CredentialCheckResult result = credentialValidator.check(mobile, request.password());
        switch (result.status()) {
            case AUTHENTICATED -> {
                SessionToken token = sessionManager.establish(session, result.principal());
                log.info("Login success userId={} ip={} ua={}", result.principal().userId(), clientKey, clientInfo.userAgent());
                return token;
            }
            case INVALID_CREDENTIALS -> {
                attemptLimiter.recordFailure(clientKey);
                log.info("Login failed mobile={} ip={} ua={}", mobile, clientKey, clientInfo.userAgent());
                throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
            }
            default -> throw new BusinessException(ErrorCode.STORAGE_ERROR, "获取用户信息失败");
        }
    }

    public Optional<SessionView> checkStatus(SessionContext session) {
        return sessionManager.current(session);
    }

    public void logout(SessionContext session) {
        sessionManager.terminate(session);
    }

    private void ensureVerificationSuccess(VerificationCheckResult result) {
        if (result.isSuccess()) {
            return;
        }
        switch (result.status()) {
            case NOT_FOUND -> throw new BusinessException(ErrorCode.CODE_EXPIRED_OR_MISSING);
            case MISMATCH -> throw new BusinessException(ErrorCode.CODE_MISMATCH);
            default -> throw new BusinessException(ErrorCode.STORAGE_ERROR, "读取短信验证码异常");
        }
    }
}
