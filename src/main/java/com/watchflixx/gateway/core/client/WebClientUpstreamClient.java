package com.watchflixx.gateway.core.client;

import com.watchflixx.gateway.core.model.Endpoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * 基于 WebClient 的上游调用实现
 *
 * <p>任何状态码都读取完整响应体后作为正常结果返回；传输错误以错误信号返回。
 * 请求路径必须是已编码的原始路径，超时由负载均衡器施加。
 */
@Slf4j
@RequiredArgsConstructor
public class WebClientUpstreamClient implements UpstreamClient {

    private final EndpointWebClientManager webClientManager;

    @Override
    public Mono<UpstreamResponse> send(Endpoint endpoint, UpstreamRequest request) {
        WebClient webClient = webClientManager.getWebClient(endpoint);
        return Mono.defer(() -> {
            long start = System.nanoTime();
            WebClient.RequestBodySpec spec = webClient.method(request.getMethod())
                    .uri(URI.create(endpoint.getUrl() + request.getPath()))
                    .headers(headers -> headers.addAll(request.getHeaders()));
            WebClient.RequestHeadersSpec<?> ready = request.hasBody() ? spec.bodyValue(request.getBody()) : spec;
            Mono<UpstreamResponse> call = ready.exchangeToMono(response -> response.bodyToMono(byte[].class)
                    .defaultIfEmpty(new byte[0])
                    .map(body -> UpstreamResponse.builder()
                            .statusCode(response.statusCode().value())
                            .headers(response.headers().asHttpHeaders())
                            .body(body)
                            .responseTimeMs((System.nanoTime() - start) / 1_000_000L)
                            .endpointUrl(endpoint.getUrl())
                            .build()));
            return call.doOnNext(response -> {
                if (log.isDebugEnabled()) {
                    log.debug("Upstream {} {}{} -> {} in {}ms, requestId={}", request.getMethod(), endpoint.getUrl(),
                            request.getPath(), response.getStatusCode(), response.getResponseTimeMs(), request.getRequestId());
                }
            });
        });
    }

    @Override
    public void release(Endpoint endpoint) {
        webClientManager.remove(endpoint);
    }
}
