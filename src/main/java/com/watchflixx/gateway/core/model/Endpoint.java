package com.watchflixx.gateway.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 后端服务的一个网络端点
 *
 * <p>每个端点只属于一个服务池。健康状态由健康探测器和负载均衡器在请求失败时更新，
 * 当前连接数由负载均衡器在调用前后原子地增减。
 */
public class Endpoint {
    private final String id;
    private final String url;
    private volatile int weight;
    private volatile EndpointHealth health = EndpointHealth.unknown();
    private final AtomicInteger currentConnections = new AtomicInteger(0);

    public Endpoint(String id, String url, int weight) {
        this.id = Objects.requireNonNull(id, "id");
        this.url = normalizeUrl(Objects.requireNonNull(url, "url"));
        this.weight = Math.max(1, weight);
    }

    public String getId() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public int getWeight() {
        return weight;
    }

    /** 权重最小为 1 */
    public void setWeight(int weight) {
        this.weight = Math.max(1, weight);
    }

    public EndpointHealth getHealth() {
        return health;
    }

    public boolean isHealthy() {
        return health.getStatus() == HealthStatus.HEALTHY;
    }

    public void markHealthy(long responseTimeMs, Instant checkedAt) {
        this.health = EndpointHealth.healthy(responseTimeMs, checkedAt);
    }

    public void markUnhealthy(String error, Long responseTimeMs, Instant checkedAt) {
        this.health = EndpointHealth.unhealthy(error, responseTimeMs, checkedAt);
    }

    public int getCurrentConnections() {
        return currentConnections.get();
    }

    public int incrementConnections() {
        return currentConnections.incrementAndGet();
    }

    /**
     * 连接数不会减到 0 以下
     */
    public void decrementConnections() {
        int v;
        do {
            v = currentConnections.get();
            if (v <= 0) {
                return;
            }
        } while (!currentConnections.compareAndSet(v, v - 1));
    }

    public static String normalizeUrl(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return "Endpoint{" + id + ", " + url + ", " + health.getStatus().label() + "}";
    }
}
