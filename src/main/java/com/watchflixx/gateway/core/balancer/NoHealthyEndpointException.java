package com.watchflixx.gateway.core.balancer;

import com.watchflixx.gateway.error.ServiceUnavailableException;

/**
 * 服务池中没有可选的健康端点
 */
public class NoHealthyEndpointException extends ServiceUnavailableException {
    private final String serviceName;

    public NoHealthyEndpointException(String serviceName, Throwable lastError) {
        super(serviceName + " service is temporarily unavailable", lastError);
        this.serviceName = serviceName;
        withDetail("reason", "no healthy endpoint");
    }

    public String getServiceName() {
        return serviceName;
    }
}
