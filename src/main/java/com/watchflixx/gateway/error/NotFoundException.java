package com.watchflixx.gateway.error;

public class NotFoundException extends GatewayException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND_ERROR, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND_ERROR, message, cause);
    }
}
