package com.watchflixx.gateway.core.balancer;

import com.watchflixx.gateway.core.client.UpstreamClient;
import com.watchflixx.gateway.error.NotFoundException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 后端服务名到负载均衡器的映射，每个服务名只对应一个服务池
 */
public class LoadBalancerRegistry {
    private final Map<String, LoadBalancer> balancers = new LinkedHashMap<>();
    private final UpstreamClient upstreamClient;
    private final Clock clock;

    public LoadBalancerRegistry(UpstreamClient upstreamClient, Clock clock) {
        this.upstreamClient = upstreamClient;
        this.clock = clock;
    }

    public synchronized LoadBalancer register(String serviceName, LoadBalancingSettings settings) {
        if (balancers.containsKey(serviceName)) {
            throw new IllegalStateException("Service " + serviceName + " is already registered");
        }
        LoadBalancer balancer = new LoadBalancer(serviceName, settings, upstreamClient, clock);
        balancers.put(serviceName, balancer);
        return balancer;
    }

    public synchronized Optional<LoadBalancer> find(String serviceName) {
        return Optional.ofNullable(balancers.get(serviceName));
    }

    public LoadBalancer require(String serviceName) {
        return find(serviceName).orElseThrow(() -> new NotFoundException("Unknown service " + serviceName));
    }

    public synchronized List<LoadBalancer> all() {
        return new ArrayList<>(balancers.values());
    }

    public synchronized Collection<String> serviceNames() {
        return new ArrayList<>(balancers.keySet());
    }
}
