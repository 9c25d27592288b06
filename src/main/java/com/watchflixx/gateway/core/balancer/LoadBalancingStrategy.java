package com.watchflixx.gateway.core.balancer;

public enum LoadBalancingStrategy {
    ROUND_ROBIN,
    LEAST_CONNECTIONS,
    WEIGHTED,
    RANDOM;

    /**
     * 兼容 "round-robin"、"least_connections" 等写法，无法识别时回退到轮询
     */
    public static LoadBalancingStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            return ROUND_ROBIN;
        }
        String normalized = value.trim().replace('-', '_');
        for (LoadBalancingStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(normalized)) {
                return strategy;
            }
        }
        return ROUND_ROBIN;
    }

    public String label() {
        return name().toLowerCase().replace('_', '-');
    }
}
