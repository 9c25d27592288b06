package com.watchflixx.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * 对外统一错误码
 */
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    AUTHENTICATION_ERROR(HttpStatus.UNAUTHORIZED),
    AUTHORIZATION_ERROR(HttpStatus.FORBIDDEN),
    NOT_FOUND_ERROR(HttpStatus.NOT_FOUND),
    RATE_LIMIT_ERROR(HttpStatus.TOO_MANY_REQUESTS),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    BAD_GATEWAY(HttpStatus.BAD_GATEWAY),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    GATEWAY_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public static ErrorCode fromStatus(int statusCode) {
        for (ErrorCode code : values()) {
            if (code.status.value() == statusCode) {
                return code;
            }
        }
        if (statusCode >= 500) {
            return INTERNAL_ERROR;
        }
        return VALIDATION_ERROR;
    }
}
