package com.watchflixx.gateway.error;

public class AuthenticationException extends GatewayException {

    public AuthenticationException(String message) {
        super(ErrorCode.AUTHENTICATION_ERROR, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorCode.AUTHENTICATION_ERROR, message, cause);
    }
}
