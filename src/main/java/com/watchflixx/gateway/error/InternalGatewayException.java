package com.watchflixx.gateway.error;

public class InternalGatewayException extends GatewayException {

    public InternalGatewayException(String message) {
        super(ErrorCode.INTERNAL_ERROR, message);
    }

    public InternalGatewayException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, message, cause);
    }
}
