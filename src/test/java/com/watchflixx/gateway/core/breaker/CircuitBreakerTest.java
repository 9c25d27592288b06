package com.watchflixx.gateway.core.breaker;

import com.watchflixx.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class CircuitBreakerTest {

    private MutableClock clock;
    private List<String> transitions;
    private CircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        transitions = new ArrayList<>();
        invocations = new AtomicInteger();
        CircuitBreakerSettings settings = CircuitBreakerSettings.defaultSettings();
        settings.setFailureThreshold(3);
        settings.setResetTimeout(Duration.ofSeconds(30));
        settings.setCallTimeout(Duration.ZERO);
        settings.setExpectedErrors(List.of("ValidationFailure"));
        breaker = new CircuitBreaker("payment", settings, clock,
                (service, from, to) -> transitions.add(from + "->" + to));
    }

    private Mono<String> succeed() {
        return Mono.fromCallable(() -> {
            invocations.incrementAndGet();
            return "ok";
        });
    }

    private Mono<String> fail() {
        return Mono.defer(() -> {
            invocations.incrementAndGet();
            return Mono.error(new IOException("boom"));
        });
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            StepVerifier.create(breaker.execute(this::fail)).expectError(IOException.class).verify();
        }
    }

    @Test
    void staysClosedBelowThreshold() {
        failTimes(2);

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getFailureCount());
    }

    @Test
    void successInClosedStateClearsFailureCount() {
        failTimes(2);
        StepVerifier.create(breaker.execute(this::succeed)).expectNext("ok").verifyComplete();

        assertEquals(0, breaker.getFailureCount());
        failTimes(2);
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void opensAtThresholdAndRejectsWithoutInvokingCall() {
        failTimes(3);
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(clock.instant().plusSeconds(30), breaker.getNextRetryTime());

        StepVerifier.create(breaker.execute(this::succeed))
                .expectErrorSatisfies(error -> {
                    CircuitBreakerOpenException open = (CircuitBreakerOpenException) error;
                    assertEquals("payment service is temporarily unavailable", open.getMessage());
                    assertEquals(503, open.getStatusCode());
                })
                .verify();
        assertEquals(3, invocations.get());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    void staysOpenUntilResetTimeoutElapses() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(29));

        StepVerifier.create(breaker.execute(this::succeed)).expectError(CircuitBreakerOpenException.class).verify();
        assertEquals(CircuitState.OPEN, breaker.getState());
    }

    @Test
    void successfulTrialClosesAndResetsCounters() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));

        StepVerifier.create(breaker.execute(this::succeed)).expectNext("ok").verifyComplete();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
        assertEquals(0, breaker.getSuccessCount());
        assertNull(breaker.getNextRetryTime());
        assertNull(breaker.snapshot().getNextRetryTime());
        assertNull(breaker.snapshot().getLastFailureTime());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void failedTrialReopensWithFreshRetryTime() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));

        StepVerifier.create(breaker.execute(this::fail)).expectError(IOException.class).verify();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(clock.instant().plusSeconds(30), breaker.getNextRetryTime());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->OPEN"), transitions);
    }

    @Test
    void halfOpenAdmitsOnlyOneTrialAtATime() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));
        Sinks.One<String> pending = Sinks.one();

        Disposable trial = breaker.execute(pending::asMono).subscribe();
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());

        StepVerifier.create(breaker.execute(this::succeed)).expectError(CircuitBreakerOpenException.class).verify();

        pending.tryEmitValue("done");
        assertEquals(CircuitState.CLOSED, breaker.getState());
        trial.dispose();
    }

    @Test
    void cancelledTrialReleasesThePermit() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));

        Disposable trial = breaker.execute(Mono::<String>never).subscribe();
        trial.dispose();

        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        StepVerifier.create(breaker.execute(this::succeed)).expectNext("ok").verifyComplete();
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void expectedErrorsAreNotCounted() {
        for (int i = 0; i < 5; i++) {
            StepVerifier.create(breaker.execute(() -> Mono.<String>error(new IllegalStateException("ValidationFailure: bad input"))))
                    .expectError(IllegalStateException.class)
                    .verify();
        }

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
    }

    @Test
    void operatorCanForceOpenAndClose() {
        breaker.forceOpen();
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertNotNull(breaker.getNextRetryTime());

        breaker.forceClose();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertNull(breaker.getNextRetryTime());
        StepVerifier.create(breaker.execute(this::succeed)).expectNext("ok").verifyComplete();
    }

    @Test
    void snapshotReportsUptimePercentage() {
        StepVerifier.create(breaker.execute(this::succeed)).expectNext("ok").verifyComplete();
        StepVerifier.create(breaker.execute(this::succeed)).expectNext("ok").verifyComplete();

        assertEquals(100.0, breaker.snapshot().getUptime(), 0.001);
        assertEquals(3, breaker.snapshot().getFailureThreshold());
    }

    @Test
    void callTimeoutCountsAsFailure() {
        CircuitBreakerSettings settings = CircuitBreakerSettings.defaultSettings();
        settings.setFailureThreshold(1);
        settings.setCallTimeout(Duration.ofMillis(50));
        CircuitBreaker timed = new CircuitBreaker("streaming", settings, clock, CircuitStateListener.NO_OP);

        StepVerifier.create(timed.execute(Mono::<String>never))
                .expectError(java.util.concurrent.TimeoutException.class)
                .verify(Duration.ofSeconds(5));
        assertEquals(CircuitState.OPEN, timed.getState());
    }
}
