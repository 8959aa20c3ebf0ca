package com.underwriting.propertydata.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Exponential-backoff retry that respects an absolute deadline.
 *
 * <p>Retries only errors whose {@link ProviderErrors#classify kind} is retryable (timeout,
 * rate limit), at most {@code maxRetries} times, waiting {@code firstBackoff * 2^n} before
 * retry {@code n}. A retry whose backoff would end after the deadline is not attempted: the
 * last error propagates unchanged so the adapter reports it as-is.
 */
public final class DeadlineAwareRetry {

    private static final Logger log = LoggerFactory.getLogger(DeadlineAwareRetry.class);

    private DeadlineAwareRetry() {}

    /**
     * @param deadline absolute deadline, or {@code null} when the caller set none
     */
    public static Retry backoff(String providerId, int maxRetries, Duration firstBackoff,
                                Instant deadline, Clock clock) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries();

            if (!ProviderErrors.isRetryable(failure)) {
                return Mono.error(failure);
            }
            if (attempt >= maxRetries) {
                log.info("Retries exhausted. provider={} attempts={} error={}",
                    providerId, attempt + 1, ProviderErrors.classify(failure));
                return Mono.error(failure);
            }

            Duration delay = firstBackoff.multipliedBy(1L << attempt);
            if (deadline != null && clock.instant().plus(delay).isAfter(deadline)) {
                log.info("Retry abandoned, backoff exceeds deadline. provider={} backoffMs={} error={}",
                    providerId, delay.toMillis(), ProviderErrors.classify(failure));
                return Mono.error(failure);
            }

            log.info("Retrying provider call. provider={} retry={} backoffMs={} error={}",
                providerId, attempt + 1, delay.toMillis(), ProviderErrors.classify(failure));
            return Mono.delay(delay);
        }));
    }
}
