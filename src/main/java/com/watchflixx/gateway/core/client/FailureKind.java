package com.watchflixx.gateway.core.client;

/**
 * 连接类失败的分类，均会触发端点下线与重试
 */
public enum FailureKind {
    CONNECTION_REFUSED,
    DNS_FAILURE,
    TIMEOUT,
    CONNECTION_RESET,
    /** 其他传输层错误 */
    TRANSPORT_ERROR,
    /** 后端返回 5xx */
    SERVER_ERROR
}
