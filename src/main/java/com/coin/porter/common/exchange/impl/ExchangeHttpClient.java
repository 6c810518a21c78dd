package com.coin.porter.common.exchange.impl;

import com.coin.porter.common.model.ExchangeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

@Slf4j
public class ExchangeHttpClient {
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration requestTimeout;

    public ExchangeHttpClient(int maxAttempts, Duration initialBackoff, Duration requestTimeout) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff;
        this.requestTimeout = requestTimeout;
    }

    public <T> T executeWithRetry(String venue, Supplier<Mono<T>> call) {
        int attempt = 0;
        long backoffMillis = initialBackoff.toMillis();
        while (true) {
            attempt++;
            try {
                return call.get().block(requestTimeout);
            } catch (ExchangeException ex) {
                throw ex;
            } catch (Exception ex) {
                if (attempt >= maxAttempts || !isRetryable(ex)) {
                    throw new ExchangeException(venue, "HTTP request failed: " + describe(ex), ex);
                }
                LOG.warn("{} request failed (attempt {}/{}), retrying in {} ms: {}", venue, attempt, maxAttempts, backoffMillis, describe(ex));
                try {
                    Thread.sleep(backoffMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ExchangeException(venue, "Retry interrupted", ie);
                }
                backoffMillis *= 2;
            }
        }
    }

    static boolean isRetryable(Throwable ex) {
        if (ex instanceof WebClientResponseException wcre) {
            int code = wcre.getStatusCode().value();
            return code == 429 || code >= 500;
        }
        if (ex instanceof TimeoutException || ex.getCause() instanceof TimeoutException) {
            return true;
        }
        return ex.getMessage() != null && ex.getMessage().toLowerCase().contains("timeout");
    }

    private static String describe(Exception ex) {
        if (ex instanceof WebClientResponseException wcre) {
            return "HTTP " + wcre.getStatusCode().value() + " " + wcre.getResponseBodyAsString();
        }
        return ex.getMessage();
    }
}
