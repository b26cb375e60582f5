package com.ihome.passport.store;

import java.time.Duration;

/**
 * 带过期时间的键值存储接口。
 * <p>
 * 验证码与登录失败计数共用此存储，允许使用 Redis 或进程内缓存实现。
 * 读操作以 {@link StoreRead} 返回存储不可用状态，由调用方决定降级策略；
 * 写操作在后端故障时抛出 {@link KeyStoreUnavailableException}。
 * `getAndDelete` 与 `incrementAndExpire` 必须在存储端原子执行。
 */
public interface EphemeralKeyStore {

    StoreRead get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * 原子地读取并删除键，返回删除前的值。
     */
    StoreRead getAndDelete(String key);

    /**
     * 原子地将计数加一（不存在时初始化为 1），并把过期时间重置为 ttl。
     *
     * @return 自增后的值
     */
    long incrementAndExpire(String key, Duration ttl);
}
