package com.ihome.passport.ratelimit;

import com.ihome.passport.config.AuthProperties;
import com.ihome.passport.store.EphemeralKeyStore;
import com.ihome.passport.store.InMemoryEphemeralKeyStore;
import com.ihome.passport.store.KeyStoreUnavailableException;
import com.ihome.passport.store.StoreRead;
import com.ihome.passport.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AttemptLimiterTest {

    private static final String CLIENT = "203.0.113.5";

    private MutableClock clock;
    private InMemoryEphemeralKeyStore store;
    private AuthProperties properties;
    private AttemptLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        store = new InMemoryEphemeralKeyStore(clock);
        properties = new AuthProperties();
        properties.getLogin().setMaxAttempts(5);
        properties.getLogin().setForbidWindow(Duration.ofMinutes(10));
        limiter = new AttemptLimiter(store, properties);
    }

    @Test
    void blocksAfterMaxAttemptsWithinWindow() {
        for (int i = 0; i < 4; i++) {
            assertThat(limiter.recordFailure(CLIENT)).isTrue();
        }
        assertThat(limiter.isBlocked(CLIENT)).isFalse();

        limiter.recordFailure(CLIENT);
        assertThat(limiter.isBlocked(CLIENT)).isTrue();
        assertThat(limiter.isBlocked("198.51.100.7")).isFalse();
    }

    @Test
    void unblocksOnceWindowElapses() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure(CLIENT);
        }
        clock.advance(Duration.ofMinutes(9));
        assertThat(limiter.isBlocked(CLIENT)).isTrue();

        clock.advance(Duration.ofMinutes(1));
        assertThat(limiter.isBlocked(CLIENT)).isFalse();
    }

    @Test
    void everyFailureRefreshesTheWindow() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure(CLIENT);
        }
        clock.advance(Duration.ofMinutes(8));
        limiter.recordFailure(CLIENT);
        clock.advance(Duration.ofMinutes(8));

        assertThat(limiter.isBlocked(CLIENT)).isTrue();
    }

    @Test
    void concurrentFailuresAreAllCounted() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                tasks.add(() -> limiter.recordFailure(CLIENT));
            }
            for (Future<Boolean> future : pool.invokeAll(tasks)) {
                assertThat(future.get()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(store.get("access_nums_" + CLIENT).value()).isEqualTo("200");
    }

    @Test
    void failsOpenWhenCounterUnavailable() {
        EphemeralKeyStore failing = mock(EphemeralKeyStore.class);
        when(failing.get(anyString())).thenReturn(StoreRead.unavailable(new RedisConnectionFailureException("down")));

        assertThat(new AttemptLimiter(failing, properties).isBlocked(CLIENT)).isFalse();
    }

    @Test
    void recordFailureReportsOutageWithoutThrowing() {
        EphemeralKeyStore failing = mock(EphemeralKeyStore.class);
        when(failing.incrementAndExpire(anyString(), any(Duration.class)))
                .thenThrow(new KeyStoreUnavailableException("down", null));

        assertThat(new AttemptLimiter(failing, properties).recordFailure(CLIENT)).isFalse();
    }

    @Test
    void malformedCounterIsIgnored() {
        store.set("access_nums_" + CLIENT, "abc", Duration.ofMinutes(1));
        assertThat(limiter.isBlocked(CLIENT)).isFalse();
    }
}
