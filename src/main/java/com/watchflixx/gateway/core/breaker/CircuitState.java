package com.watchflixx.gateway.core.breaker;

public enum CircuitState {
    /** 正常放行 */
    CLOSED,
    /** 快速失败 */
    OPEN,
    /** 允许一次试探调用 */
    HALF_OPEN
}
