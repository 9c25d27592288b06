package com.watchflixx.gateway.error;

public class GatewayTimeoutException extends GatewayException {

    public GatewayTimeoutException(String message) {
        super(ErrorCode.GATEWAY_TIMEOUT, message);
    }

    public GatewayTimeoutException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_TIMEOUT, message, cause);
    }
}
