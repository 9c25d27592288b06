package com.watchflixx.gateway.core.client;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.netty.http.client.PrematureCloseException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * 把原始传输异常归类为 {@link UpstreamException}
 */
public final class UpstreamFailures {

    private UpstreamFailures() {
    }

    /**
     * @return 连接类失败对应的异常；不是连接类失败时返回 null
     */
    public static UpstreamException classify(Throwable error, String endpointUrl) {
        if (error instanceof UpstreamException) {
            return (UpstreamException) error;
        }
        FailureKind kind = kindOf(error);
        if (kind == null) {
            return null;
        }
        String message = "Upstream " + endpointUrl + " failed: " + kind.name().toLowerCase()
                + (error.getMessage() == null ? "" : " (" + error.getMessage() + ")");
        return new UpstreamException(kind, endpointUrl, null, message, error);
    }

    private static FailureKind kindOf(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof ReadTimeoutException
                    || current instanceof WriteTimeoutException
                    || current instanceof ConnectTimeoutException) {
                return FailureKind.TIMEOUT;
            }
            if (current instanceof UnknownHostException) {
                return FailureKind.DNS_FAILURE;
            }
            if (current instanceof ConnectException) {
                return FailureKind.CONNECTION_REFUSED;
            }
            if (current instanceof PrematureCloseException) {
                return FailureKind.CONNECTION_RESET;
            }
            if (current instanceof IOException && current.getMessage() != null
                    && current.getMessage().toLowerCase().contains("reset")) {
                return FailureKind.CONNECTION_RESET;
            }
            current = current.getCause();
        }
        if (error instanceof WebClientRequestException) {
            return FailureKind.TRANSPORT_ERROR;
        }
        return null;
    }
}
