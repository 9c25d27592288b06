package com.watchflixx.gateway.core.breaker;

import com.watchflixx.gateway.dto.CircuitBreakerStatusDto;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 单个后端服务的熔断器
 *
 * <p>状态机：
 * <ul>
 *   <li><b>CLOSED</b>：正常放行，失败计数达到阈值后进入 OPEN</li>
 *   <li><b>OPEN</b>：在 nextRetryTime 之前直接拒绝，不执行被保护的调用</li>
 *   <li><b>HALF_OPEN</b>：只放行一次试探调用，成功则关闭并清零计数，失败则重新打开</li>
 * </ul>
 *
 * <p>所有状态迁移都在同一把锁内完成；并发失败同时达到阈值时只会发生一次迁移，
 * nextRetryTime 以最后一次写入为准。HALF_OPEN 期间试探调用尚未结束时，其他调用一律拒绝。
 *
 * <p>调用结果只结算一次：成功、失败或取消三者之一。被取消的试探调用会释放试探许可，
 * 熔断器保持 HALF_OPEN，下一次调用重新试探。
 */
@Slf4j
public class CircuitBreaker {

    private enum Permit { ALLOWED, TRIAL, REJECTED }

    private final String serviceName;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final CircuitStateListener listener;

    private final Object lock = new Object();
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private long lastFailureTime;
    private long nextRetryTime;
    private boolean trialInFlight;

    public CircuitBreaker(String serviceName, CircuitBreakerSettings settings, Clock clock, CircuitStateListener listener) {
        this.serviceName = serviceName;
        this.settings = settings.copy();
        this.clock = clock;
        this.listener = listener == null ? CircuitStateListener.NO_OP : listener;
    }

    /**
     * 在熔断器保护下执行调用
     *
     * <p>OPEN 且未到重试时间时返回 {@link CircuitBreakerOpenException}，{@code call} 不会被调用。
     * 其余情况下调用结果原样透传，同时更新失败/成功计数。
     *
     * @param call 被保护的调用，订阅时才会真正发起
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            Permit permit = acquirePermit();
            if (permit == Permit.REJECTED) {
                return Mono.error(new CircuitBreakerOpenException(serviceName, getNextRetryTime()));
            }
            boolean trial = permit == Permit.TRIAL;
            AtomicBoolean settled = new AtomicBoolean(false);

            Mono<T> guarded = Mono.defer(call);
            if (!settings.getCallTimeout().isZero()) {
                guarded = guarded.timeout(settings.getCallTimeout());
            }
            return guarded
                    .doOnSuccess(value -> {
                        if (settled.compareAndSet(false, true)) {
                            onSuccess(trial);
                        }
                    })
                    .doOnError(error -> {
                        if (settled.compareAndSet(false, true)) {
                            onFailure(error, trial);
                        }
                    })
                    .doOnCancel(() -> {
                        if (settled.compareAndSet(false, true)) {
                            releaseTrial(trial);
                        }
                    });
        });
    }

    private Permit acquirePermit() {
        synchronized (lock) {
            switch (state) {
                case CLOSED:
                    return Permit.ALLOWED;
                case OPEN:
                    if (clock.millis() < nextRetryTime) {
                        return Permit.REJECTED;
                    }
                    transitionTo(CircuitState.HALF_OPEN);
                    trialInFlight = true;
                    return Permit.TRIAL;
                case HALF_OPEN:
                default:
                    if (trialInFlight) {
                        return Permit.REJECTED;
                    }
                    trialInFlight = true;
                    return Permit.TRIAL;
            }
        }
    }

    private void onSuccess(boolean trial) {
        synchronized (lock) {
            successCount++;
            if (trial && state == CircuitState.HALF_OPEN) {
                failureCount = 0;
                successCount = 0;
                lastFailureTime = 0;
                nextRetryTime = 0;
                trialInFlight = false;
                transitionTo(CircuitState.CLOSED);
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
        }
    }

    private void onFailure(Throwable error, boolean trial) {
        if (isExpectedError(error)) {
            log.debug("Expected error for {} not counted: {}", serviceName, error.getMessage());
            releaseTrial(trial);
            return;
        }
        synchronized (lock) {
            failureCount++;
            lastFailureTime = clock.millis();
            if (trial && state == CircuitState.HALF_OPEN) {
                open();
            } else if (state == CircuitState.CLOSED && failureCount >= settings.getFailureThreshold()) {
                open();
            }
        }
    }

    private void releaseTrial(boolean trial) {
        if (!trial) {
            return;
        }
        synchronized (lock) {
            if (state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
            }
        }
    }

    private boolean isExpectedError(Throwable error) {
        if (settings.getExpectedErrors().isEmpty()) {
            return false;
        }
        String text = describe(error);
        for (String expected : settings.getExpectedErrors()) {
            if (expected != null && !expected.isEmpty() && text.contains(expected)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    // 调用方必须持有 lock
    private void open() {
        nextRetryTime = clock.millis() + settings.getResetTimeout().toMillis();
        trialInFlight = false;
        transitionTo(CircuitState.OPEN);
    }

    // 调用方必须持有 lock
    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (previous != next) {
            listener.onStateChange(serviceName, previous, next);
        }
    }

    /**
     * 运维手动打开熔断器
     */
    public void forceOpen() {
        synchronized (lock) {
            open();
        }
    }

    /**
     * 运维手动关闭熔断器并清零计数
     */
    public void forceClose() {
        synchronized (lock) {
            failureCount = 0;
            successCount = 0;
            lastFailureTime = 0;
            nextRetryTime = 0;
            trialInFlight = false;
            transitionTo(CircuitState.CLOSED);
        }
    }

    public CircuitState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public int getFailureCount() {
        synchronized (lock) {
            return failureCount;
        }
    }

    public int getSuccessCount() {
        synchronized (lock) {
            return successCount;
        }
    }

    public Instant getNextRetryTime() {
        synchronized (lock) {
            return nextRetryTime == 0 ? null : Instant.ofEpochMilli(nextRetryTime);
        }
    }

    public String getServiceName() {
        return serviceName;
    }

    public CircuitBreakerSettings getSettings() {
        return settings.copy();
    }

    public CircuitBreakerStatusDto snapshot() {
        synchronized (lock) {
            CircuitBreakerStatusDto dto = new CircuitBreakerStatusDto();
            dto.setServiceName(serviceName);
            dto.setState(state.name());
            dto.setFailureCount(failureCount);
            dto.setSuccessCount(successCount);
            dto.setLastFailureTime(lastFailureTime == 0 ? null : Instant.ofEpochMilli(lastFailureTime).toString());
            dto.setNextRetryTime(nextRetryTime == 0 ? null : Instant.ofEpochMilli(nextRetryTime).toString());
            int total = failureCount + successCount;
            dto.setUptime(total == 0 ? 100.0d : (successCount * 100.0d) / total);
            dto.setFailureThreshold(settings.getFailureThreshold());
            return dto;
        }
    }
}
