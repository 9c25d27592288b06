package com.watchflixx.gateway.core.rate;

import com.watchflixx.gateway.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RedisRateLimitStoreTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final StringRedisTemplate template = mock(StringRedisTemplate.class);
    private final RedisRateLimitStore store = new RedisRateLimitStore(template, clock);

    @Test
    void readsCountFromScriptAndResetFromRemainingTtl() {
        when(template.execute(any(RedisScript.class), eq(List.of("watchflixx:ratelimit:tight:user:1")), eq("60000")))
                .thenReturn(3L);
        when(template.getExpire("watchflixx:ratelimit:tight:user:1", TimeUnit.MILLISECONDS)).thenReturn(42_000L);

        WindowCount count = store.increment("tight:user:1", Duration.ofSeconds(60));

        assertEquals(3, count.getCount());
        assertEquals(clock.millis() + 42_000, count.getResetTime());
        assertTrue(store.isBlocking());
    }

    @Test
    void missingTtlFallsBackToFullWindow() {
        when(template.execute(any(RedisScript.class), eq(List.of("watchflixx:ratelimit:k")), eq("1000")))
                .thenReturn(1L);
        when(template.getExpire("watchflixx:ratelimit:k", TimeUnit.MILLISECONDS)).thenReturn(-1L);

        assertEquals(clock.millis() + 1000, store.increment("k", Duration.ofSeconds(1)).getResetTime());
    }

    @Test
    void missingScriptResultIsAnError() {
        assertThrows(IllegalStateException.class, () -> store.increment("k", Duration.ofSeconds(1)));
    }
}
