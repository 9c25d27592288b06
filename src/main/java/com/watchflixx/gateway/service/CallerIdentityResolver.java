package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.model.CallerIdentity;
import org.springframework.http.HttpHeaders;

/**
 * 从入站请求头解析调用方身份
 *
 * <p>令牌校验由认证服务负责，网关只消费已验证的身份信息。
 */
public interface CallerIdentityResolver {

    /**
     * @return 调用方身份，匿名请求返回 null
     */
    CallerIdentity resolve(HttpHeaders headers);
}
