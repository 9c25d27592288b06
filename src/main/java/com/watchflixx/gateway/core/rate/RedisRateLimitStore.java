package com.watchflixx.gateway.core.rate;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Redis 的固定窗口计数，多个网关实例共享配额
 *
 * <p>使用 Lua 脚本原子地完成 INCR 和首次设置过期，随后读取剩余 TTL 作为窗口结束时间。
 */
@Slf4j
public class RedisRateLimitStore implements RateLimitStore {

    private static final String KEY_PREFIX = "watchflixx:ratelimit:";

    /**
     * Lua 脚本：计数加一，首次自增或 key 丢失过期时间时设置毫秒级过期，返回当前计数
     */
    private static final String INCREMENT_SCRIPT =
        "local current = redis.call('incr', KEYS[1]) " +
        "if current == 1 or redis.call('pttl', KEYS[1]) < 0 then " +
        "  redis.call('pexpire', KEYS[1], ARGV[1]) " +
        "end " +
        "return current";

    private final StringRedisTemplate stringRedisTemplate;
    private final DefaultRedisScript<Long> incrementScript;
    private final Clock clock;

    public RedisRateLimitStore(StringRedisTemplate stringRedisTemplate, Clock clock) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.clock = clock;
        this.incrementScript = new DefaultRedisScript<>();
        this.incrementScript.setScriptText(INCREMENT_SCRIPT);
        this.incrementScript.setResultType(Long.class);
    }

    @Override
    public WindowCount increment(String key, Duration window) {
        long windowMs = window.toMillis();
        String redisKey = KEY_PREFIX + key;
        Long count = stringRedisTemplate.execute(
                incrementScript,
                Collections.singletonList(redisKey),
                String.valueOf(windowMs));
        if (count == null) {
            throw new IllegalStateException("Unexpected rate limit script result for key " + key);
        }
        Long ttl = stringRedisTemplate.getExpire(redisKey, TimeUnit.MILLISECONDS);
        // 过期时间已不存在（ttl 为空或小于 0）时按完整窗口计算
        long resetTime = clock.millis() + (ttl == null || ttl < 0 ? windowMs : ttl);
        return new WindowCount(count, resetTime);
    }

    @Override
    public boolean isBlocking() {
        return true;
    }
}
