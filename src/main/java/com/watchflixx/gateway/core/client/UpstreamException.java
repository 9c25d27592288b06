package com.watchflixx.gateway.core.client;

/**
 * 已分类的上游调用失败
 */
public class UpstreamException extends RuntimeException {
    private final FailureKind kind;
    private final String endpointUrl;
    private final Integer statusCode;

    public UpstreamException(FailureKind kind, String endpointUrl, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.endpointUrl = endpointUrl;
        this.statusCode = statusCode;
    }

    public static UpstreamException serverError(String endpointUrl, int statusCode) {
        return new UpstreamException(FailureKind.SERVER_ERROR, endpointUrl, statusCode,
                "Upstream " + endpointUrl + " responded with status " + statusCode, null);
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
