package com.watchflixx.gateway.error;

public class BadGatewayException extends GatewayException {

    public BadGatewayException(String message) {
        super(ErrorCode.BAD_GATEWAY, message);
    }

    public BadGatewayException(String message, Throwable cause) {
        super(ErrorCode.BAD_GATEWAY, message, cause);
    }
}
