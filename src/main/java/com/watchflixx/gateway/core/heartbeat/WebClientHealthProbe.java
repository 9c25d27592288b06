package com.watchflixx.gateway.core.heartbeat;

import com.watchflixx.gateway.core.client.EndpointWebClientManager;
import com.watchflixx.gateway.core.model.Endpoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * GET {endpoint}/health，超时内返回 2xx 视为健康
 *
 * <p>使用端点专用的 WebClient，与业务请求共用连接池。
 */
@Slf4j
@RequiredArgsConstructor
public class WebClientHealthProbe implements HealthProbe {

    private final EndpointWebClientManager webClientManager;

    @Override
    public Mono<ProbeResult> probe(Endpoint endpoint, String healthPath, Duration timeout) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return webClientManager.getWebClient(endpoint)
                    .get()
                    .uri(healthPath)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .map(response -> {
                        long elapsed = elapsedMs(start);
                        int status = response.getStatusCode().value();
                        return response.getStatusCode().is2xxSuccessful()
                                ? ProbeResult.healthy(status, elapsed)
                                : ProbeResult.unhealthy(status, elapsed, "Health check returned status " + status);
                    })
                    .onErrorResume(error -> {
                        log.debug("Health check of {} failed: {}", endpoint.getUrl(), error.toString());
                        return Mono.just(ProbeResult.unhealthy(statusOf(error), elapsedMs(start), describe(error, timeout)));
                    });
        });
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static Integer statusOf(Throwable error) {
        if (error instanceof WebClientResponseException) {
            return ((WebClientResponseException) error).getStatusCode().value();
        }
        return null;
    }

    private static String describe(Throwable error, Duration timeout) {
        if (error instanceof TimeoutException) {
            return "Health check timed out after " + timeout.toMillis() + "ms";
        }
        Integer status = statusOf(error);
        if (status != null) {
            return "Health check returned status " + status;
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
