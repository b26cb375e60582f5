package com.ihome.passport.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * 基于 Redis 的键值存储实现。
 * <p>
 * 读取并删除使用 `GETDEL`，计数自增与续期通过 Lua 脚本一次往返完成，
 * 保证并发请求下不丢失计数。Redis 命令超时由 `spring.data.redis.timeout` 控制，
 * 超时与连接失败均以 {@link DataAccessException} 形式出现并在此处转换。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisEphemeralKeyStore implements EphemeralKeyStore {

    static final String INCR_EXPIRE_LUA = "\n" +
            "local v = redis.call('INCR', KEYS[1])\n" +
            "redis.call('PEXPIRE', KEYS[1], ARGV[1])\n" +
            "return v\n";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> incrScript;

    public RedisEphemeralKeyStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.incrScript = new DefaultRedisScript<>();
        this.incrScript.setResultType(Long.class);
        this.incrScript.setScriptText(INCR_EXPIRE_LUA);
    }

    @Override
    public StoreRead get(String key) {
        try {
            return StoreRead.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException ex) {
            log.error("Redis GET failed key={}", key, ex);
            return StoreRead.unavailable(ex);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException ex) {
            throw new KeyStoreUnavailableException("Failed to set key " + key, ex);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException ex) {
            throw new KeyStoreUnavailableException("Failed to delete key " + key, ex);
        }
    }

    @Override
    public StoreRead getAndDelete(String key) {
        try {
            return StoreRead.ofNullable(redisTemplate.opsForValue().getAndDelete(key));
        } catch (DataAccessException ex) {
            log.error("Redis GETDEL failed key={}", key, ex);
            return StoreRead.unavailable(ex);
        }
    }

    @Override
    public long incrementAndExpire(String key, Duration ttl) {
        Long value;
        try {
            value = redisTemplate.execute(incrScript, List.of(key), String.valueOf(ttl.toMillis()));
        } catch (DataAccessException ex) {
            throw new KeyStoreUnavailableException("Failed to increment key " + key, ex);
        }
        if (value == null) {
            throw new KeyStoreUnavailableException("Empty reply incrementing key " + key, null);
        }
        return value;
    }
}
