package com.watchflixx.gateway.core.rate;

/**
 * 限流计数键的来源
 */
public enum KeyStrategy {
    /** 已认证时按用户，否则按客户端地址 */
    CALLER,
    /** 只按客户端地址，用于登录等匿名接口 */
    CLIENT_ADDRESS
}
