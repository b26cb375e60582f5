package com.ihome.passport.verification;

import lombok.extern.slf4j.Slf4j;
import com.ihome.passport.config.AuthProperties;
import com.ihome.passport.store.EphemeralKeyStore;
import com.ihome.passport.store.StoreRead;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * 注册短信验证码账本。
 * <p>
 * 验证码由外部发送流程写入 `sms_code_{手机号}`，此处只负责一次性消费：
 * 先原子地读取并删除，再比对。无论比对结果如何验证码都已作废，
 * 输错的用户需要重新获取验证码，同一验证码不可能被重放。
 */
@Slf4j
@Component
public class VerificationCodeLedger {

    private final EphemeralKeyStore keyStore;
    private final AuthProperties properties;

    public VerificationCodeLedger(EphemeralKeyStore keyStore, AuthProperties properties) {
        this.keyStore = keyStore;
        this.properties = properties;
    }

    public VerificationCheckResult consume(String subjectKey, String submittedCode) {
        StoreRead stored = keyStore.getAndDelete(buildKey(subjectKey));
        if (stored.isUnavailable()) {
            return VerificationCheckResult.STORE_UNAVAILABLE;
        }
        if (!stored.isPresent()) {
            return VerificationCheckResult.NOT_FOUND;
        }
        if (!Objects.equals(stored.value(), submittedCode)) {
            log.info("Verification code mismatch subject={}", subjectKey);
            return VerificationCheckResult.MISMATCH;
        }
        return VerificationCheckResult.SUCCESS;
    }

    String buildKey(String subjectKey) {
        return properties.getVerification().getKeyPrefix() + subjectKey;
    }
}
