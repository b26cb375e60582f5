package com.ihome.passport.ratelimit;

import lombok.extern.slf4j.Slf4j;
import com.ihome.passport.config.AuthProperties;
import com.ihome.passport.store.EphemeralKeyStore;
import com.ihome.passport.store.KeyStoreUnavailableException;
import com.ihome.passport.store.StoreRead;
import org.springframework.stereotype.Component;

/**
 * 按客户端地址统计登录失败次数。
 * <p>
 * 记录键为 `access_nums_{ip}`，每次失败自增并把过期时间重置为 `forbidWindow`。
 * 计数达到 `maxAttempts` 后在窗口期内拒绝该地址的登录请求。
 * <ul>
 *     <li>存储不可用时放行（fail-open）：限流组件故障不能把所有用户挡在门外；</li>
 *     <li>登录成功不清零，计数只随过期时间消失。</li>
 * </ul>
 */
@Slf4j
@Component
public class AttemptLimiter {

    private final EphemeralKeyStore keyStore;
    private final AuthProperties properties;

    public AttemptLimiter(EphemeralKeyStore keyStore, AuthProperties properties) {
        this.keyStore = keyStore;
        this.properties = properties;
    }

    public boolean isBlocked(String clientKey) {
        StoreRead read = keyStore.get(buildKey(clientKey));
        if (read.isUnavailable()) {
            log.warn("Attempt counter unavailable, allowing login client={}", clientKey);
            return false;
        }
        if (!read.isPresent()) {
            return false;
        }
        long count;
        try {
            count = Long.parseLong(read.value().trim());
        } catch (NumberFormatException ex) {
            log.warn("Ignoring malformed attempt counter client={} value={}", clientKey, read.value());
            return false;
        }
        return count >= properties.getLogin().getMaxAttempts();
    }

    /**
     * 记录一次失败。
     *
     * @return 是否记录成功；存储不可用时返回 false，调用方的原始失败结果不受影响
     */
    public boolean recordFailure(String clientKey) {
        try {
            long count = keyStore.incrementAndExpire(buildKey(clientKey), properties.getLogin().getForbidWindow());
            if (count == properties.getLogin().getMaxAttempts()) {
                log.warn("Client reached login failure limit client={} attempts={}", clientKey, count);
            }
            return true;
        } catch (KeyStoreUnavailableException ex) {
            log.error("Failed to record login failure client={}", clientKey, ex);
            return false;
        }
    }

    String buildKey(String clientKey) {
        return properties.getLogin().getKeyPrefix() + clientKey;
    }
}
