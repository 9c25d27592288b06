package com.watchflixx.gateway.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 网关异常基类
 *
 * <p>所有返回给调用方的错误最终都会被转换为该类型，再由 {@link GlobalErrorHandler}
 * 序列化为统一响应信封。{@code details} 中的内容仅在诊断模式下返回。
 */
public class GatewayException extends RuntimeException {
    private final ErrorCode errorCode;
    private final Map<String, Object> details = new LinkedHashMap<>();

    public GatewayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatus().value();
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    public GatewayException withDetail(String key, Object value) {
        details.put(key, value);
        return this;
    }
}
