package com.watchflixx.gateway.support;

import com.watchflixx.gateway.core.client.UpstreamClient;
import com.watchflixx.gateway.core.client.UpstreamRequest;
import com.watchflixx.gateway.core.client.UpstreamResponse;
import com.watchflixx.gateway.core.model.Endpoint;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 按端点 URL 编排响应的上游客户端，记录每次调用
 */
public class FakeUpstreamClient implements UpstreamClient {

    private final Map<String, Function<UpstreamRequest, Mono<UpstreamResponse>>> behaviours = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<UpstreamRequest> requests = new CopyOnWriteArrayList<>();
    private final List<String> released = new CopyOnWriteArrayList<>();

    public FakeUpstreamClient respond(String url, int status) {
        return respond(url, status, "");
    }

    public FakeUpstreamClient respond(String url, int status, String body) {
        behaviours.put(url, request -> Mono.just(response(url, status, body)));
        return this;
    }

    public FakeUpstreamClient refuse(String url) {
        behaviours.put(url, request -> Mono.error(new ConnectException("Connection refused: " + url)));
        return this;
    }

    public FakeUpstreamClient hang(String url) {
        behaviours.put(url, request -> Mono.never());
        return this;
    }

    public FakeUpstreamClient behave(String url, Function<UpstreamRequest, Mono<UpstreamResponse>> behaviour) {
        behaviours.put(url, behaviour);
        return this;
    }

    @Override
    public Mono<UpstreamResponse> send(Endpoint endpoint, UpstreamRequest request) {
        return Mono.defer(() -> {
            calls.add(endpoint.getUrl());
            requests.add(request);
            Function<UpstreamRequest, Mono<UpstreamResponse>> behaviour = behaviours.get(endpoint.getUrl());
            if (behaviour == null) {
                return Mono.just(response(endpoint.getUrl(), 200, "ok"));
            }
            return behaviour.apply(request);
        });
    }

    @Override
    public void release(Endpoint endpoint) {
        released.add(endpoint.getUrl());
    }

    public List<String> calls() {
        return calls;
    }

    public List<UpstreamRequest> requests() {
        return requests;
    }

    public List<String> released() {
        return released;
    }

    public static UpstreamResponse response(String url, int status, String body) {
        return UpstreamResponse.builder()
                .statusCode(status)
                .body(body.getBytes())
                .responseTimeMs(5)
                .endpointUrl(url)
                .build();
    }
}
