package com.underwriting.propertydata.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.underwriting.common.model.ProviderErrorKind;
import io.netty.channel.ConnectTimeoutException;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps whatever went wrong inside an adapter call onto the closed
 * {@link ProviderErrorKind} taxonomy.
 */
public final class ProviderErrors {

    private ProviderErrors() {}

    public static ProviderErrorKind classify(Throwable error) {
        if (error instanceof ProviderCallException call) {
            return call.getKind();
        }
        if (error instanceof WebClientResponseException response) {
            return ProviderErrorKind.fromHttpStatus(response.getStatusCode().value());
        }
        if (isTimeout(error)) {
            return ProviderErrorKind.TIMEOUT;
        }
        if (error instanceof JsonProcessingException || error instanceof DecodingException) {
            return ProviderErrorKind.PARSE_ERROR;
        }
        return ProviderErrorKind.UNAVAILABLE;
    }

    public static boolean isRetryable(Throwable error) {
        return classify(error).isRetryable();
    }

    /** Walks the cause chain: WebClient wraps Netty read/connect timeouts. */
    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof io.netty.handler.timeout.TimeoutException
                    || t instanceof ConnectTimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
