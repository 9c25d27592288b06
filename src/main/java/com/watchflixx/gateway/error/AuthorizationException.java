package com.watchflixx.gateway.error;

public class AuthorizationException extends GatewayException {

    public AuthorizationException(String message) {
        super(ErrorCode.AUTHORIZATION_ERROR, message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(ErrorCode.AUTHORIZATION_ERROR, message, cause);
    }
}
