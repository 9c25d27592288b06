package com.watchflixx.gateway.error;

/**
 * 服务暂不可用：没有健康端点或熔断器处于打开状态
 */
public class ServiceUnavailableException extends GatewayException {

    public ServiceUnavailableException(String message) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message, cause);
    }
}
