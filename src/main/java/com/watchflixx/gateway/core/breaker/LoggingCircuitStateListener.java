package com.watchflixx.gateway.core.breaker;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingCircuitStateListener implements CircuitStateListener {

    @Override
    public void onStateChange(String serviceName, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit breaker for {} opened (was {})", serviceName, from);
        } else {
            log.info("Circuit breaker for {} moved {} -> {}", serviceName, from, to);
        }
    }
}
