package com.watchflixx.gateway.core.client;

import com.watchflixx.gateway.core.model.Endpoint;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 端点专用 WebClient 管理器
 *
 * <p>为每个端点维护独立的 WebClient 和连接池：
 * <ul>
 *   <li><b>按端点复用连接</b>：连接只用于对应端点，避免不同后端之间争抢</li>
 *   <li><b>按需创建</b>：首次调用时创建，代理请求与健康探测共用</li>
 *   <li><b>及时释放</b>：端点被移除时立即释放其连接池</li>
 * </ul>
 *
 * <p>响应超时不在 HttpClient 上设置，由每次调用按路由超时控制。
 */
@Slf4j
public class EndpointWebClientManager {

    /** 端点 WebClient 缓存，key 为端点 ID */
    private final Map<String, WebClient> webClientCache = new ConcurrentHashMap<>();
    /** 连接池缓存，key 为端点 ID */
    private final Map<String, ConnectionProvider> connectionProviderCache = new ConcurrentHashMap<>();
    private final AtomicInteger poolCounter = new AtomicInteger(0);
    private final ClientSettings settings;

    public EndpointWebClientManager(ClientSettings settings) {
        this.settings = settings;
    }

    public WebClient getWebClient(Endpoint endpoint) {
        WebClient webClient = webClientCache.get(endpoint.getId());
        if (webClient != null) {
            return webClient;
        }
        // 双重检查，避免同一端点重复创建连接池
        synchronized (this) {
            webClient = webClientCache.get(endpoint.getId());
            if (webClient != null) {
                return webClient;
            }
            webClient = createWebClient(endpoint);
            webClientCache.put(endpoint.getId(), webClient);
            log.info("Created WebClient for endpoint {} ({})", endpoint.getId(), endpoint.getUrl());
            return webClient;
        }
    }

    private WebClient createWebClient(Endpoint endpoint) {
        String poolName = "endpoint-pool-" + endpoint.getId() + "-" + poolCounter.incrementAndGet();
        ConnectionProvider connectionProvider = ConnectionProvider.builder(poolName)
                .maxConnections(settings.getMaxConnectionsPerEndpoint())
                .maxIdleTime(settings.getMaxIdleTime())
                .maxLifeTime(settings.getMaxLifeTime())
                .pendingAcquireTimeout(settings.getPendingAcquireTimeout())
                .evictInBackground(Duration.ofSeconds(30))
                .build();
        connectionProviderCache.put(endpoint.getId(), connectionProvider);

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.getConnectTimeout().toMillis())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .doOnConnected(conn -> conn.addHandlerLast(new WriteTimeoutHandler(60, TimeUnit.SECONDS)))
                .wiretap(false);

        return WebClient.builder()
                .baseUrl(endpoint.getUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> {
                    configurer.defaultCodecs().maxInMemorySize(settings.getMaxInMemorySize());
                    configurer.defaultCodecs().enableLoggingRequestDetails(false);
                })
                .build();
    }

    /**
     * 移除端点的 WebClient 并释放连接池
     */
    public void remove(Endpoint endpoint) {
        remove(endpoint.getId());
    }

    private void remove(String endpointId) {
        webClientCache.remove(endpointId);
        ConnectionProvider connectionProvider = connectionProviderCache.remove(endpointId);
        if (connectionProvider != null) {
            connectionProvider.disposeLater()
                    .subscribe(
                            unused -> { },
                            error -> log.warn("Failed to dispose connection pool for endpoint {}: {}",
                                    endpointId, error.getMessage()),
                            () -> log.debug("Disposed connection pool for endpoint {}", endpointId));
        }
        log.info("Removed WebClient for endpoint {}", endpointId);
    }

    public int getEndpointCount() {
        return webClientCache.size();
    }

    /**
     * 释放全部连接池
     */
    public void destroy() {
        log.info("Shutting down EndpointWebClientManager, cleaning up {} endpoints", webClientCache.size());
        Set<String> allIds = new HashSet<>(webClientCache.keySet());
        for (String endpointId : allIds) {
            remove(endpointId);
        }
    }
}
