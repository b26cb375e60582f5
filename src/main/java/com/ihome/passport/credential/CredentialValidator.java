package com.ihome.passport.credential;

import lombok.extern.slf4j.Slf4j;
import com.ihome.passport.user.User;
import com.ihome.passport.user.UserService;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 手机号 + 密码校验。
 * <p>
 * 账号不存在时仍对占位哈希做一次比对，使两种失败的耗时接近，避免通过响应时间枚举已注册手机号。
 */
@Slf4j
@Component
public class CredentialValidator {

    private final UserService userService;
    private final PasswordEncoder passwordEncoder;
    private final String placeholderHash;

    public CredentialValidator(UserService userService, PasswordEncoder passwordEncoder) {
        this.userService = userService;
        this.passwordEncoder = passwordEncoder;
        this.placeholderHash = passwordEncoder.encode("placeholder-credential");
    }

    public CredentialCheckResult check(String identity, String submittedSecret) {
        Optional<User> user;
        try {
            user = userService.findByMobile(identity);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Failed to load user for credential check identity={}", identity, ex);
            return CredentialCheckResult.STORE_UNAVAILABLE;
        }
        Optional<String> storedHash = user.map(User::getPasswordHash).filter(StringUtils::hasText);
        boolean matches = passwordEncoder.matches(submittedSecret, storedHash.orElse(placeholderHash));
        if (storedHash.isEmpty() || !matches) {
            return CredentialCheckResult.INVALID;
        }
        User found = user.get();
        return CredentialCheckResult.authenticated(new AuthenticatedPrincipal(found.getId(), found.getName(), found.getMobile()));
    }
}
