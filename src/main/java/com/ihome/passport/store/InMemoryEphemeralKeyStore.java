package com.ihome.passport.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程内键值存储，用于本地开发与单实例部署。
 * <p>
 * 基于 Caffeine 的按条目过期；单键操作通过 {@link ConcurrentMap#compute} 保证原子性。
 * 过期判断以注入的 {@link Clock} 为准，Caffeine 的 ticker 也由同一时钟驱动。
 */
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "type", havingValue = "memory")
public class InMemoryEphemeralKeyStore implements EphemeralKeyStore {

    private static final long MAX_ENTRIES = 100_000;

    private final Clock clock;
    private final ConcurrentMap<String, Entry> entries;

    public InMemoryEphemeralKeyStore(Clock clock) {
        this.clock = clock;
        Cache<String, Entry> cache = Caffeine.newBuilder()
                .maximumSize(MAX_ENTRIES)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new EntryExpiry())
                .build();
        this.entries = cache.asMap();
    }

    @Override
    public StoreRead get(String key) {
        Instant now = clock.instant();
        Entry entry = entries.computeIfPresent(key, (k, old) -> old.isExpired(now) ? null : old);
        return entry == null ? StoreRead.absent() : StoreRead.present(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public StoreRead getAndDelete(String key) {
        Instant now = clock.instant();
        AtomicReference<Entry> removed = new AtomicReference<>();
        entries.computeIfPresent(key, (k, old) -> {
            if (!old.isExpired(now)) {
                removed.set(old);
            }
            return null;
        });
        Entry entry = removed.get();
        return entry == null ? StoreRead.absent() : StoreRead.present(entry.value());
    }

    @Override
    public long incrementAndExpire(String key, Duration ttl) {
        Instant now = clock.instant();
        Entry entry = entries.compute(key, (k, old) -> {
            long current = 0;
            if (old != null && !old.isExpired(now)) {
                current = parseCounter(old.value());
            }
            return new Entry(String.valueOf(current + 1), now.plus(ttl));
        });
        return Long.parseLong(entry.value());
    }

    private static long parseCounter(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            // 与 Redis INCR 一致：非整数值不可自增
            throw new KeyStoreUnavailableException("Value is not an integer", ex);
        }
    }

    private record Entry(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(Entry value) {
            return Math.max(0, Duration.between(clock.instant(), value.expiresAt()).toNanos());
        }
    }
}
