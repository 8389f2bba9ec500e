package com.researchplatform.webresearch.resilience;

import com.researchplatform.common.exception.CircuitOpenException;
import com.researchplatform.common.exception.TransportException;
import com.researchplatform.common.model.EndpointKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one upstream call under the endpoint's circuit breaker, a per-endpoint timeout and
 * exponential backoff retry.
 *
 * <p>The breaker sees the retried call as a single unit: it records one failure once retries
 * are exhausted, or immediately for a non-retryable failure. An open breaker fails the call
 * with {@link CircuitOpenException} without invoking the supplier.
 */
public class ResilientRequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResilientRequestExecutor.class);

    private final CircuitBreakerRegistry breakers;
    private final RetryPolicy retryPolicy;
    private final Map<EndpointKind, Duration> timeouts;
    private final Scheduler scheduler;

    public ResilientRequestExecutor(CircuitBreakerRegistry breakers,
                                    RetryPolicy retryPolicy,
                                    Map<EndpointKind, Duration> timeouts,
                                    Scheduler scheduler) {
        this.breakers    = breakers;
        this.retryPolicy = retryPolicy;
        this.timeouts    = new EnumMap<>(timeouts);
        this.scheduler   = scheduler;
    }

    public static Map<EndpointKind, Duration> defaultTimeouts() {
        Map<EndpointKind, Duration> timeouts = new EnumMap<>(EndpointKind.class);
        timeouts.put(EndpointKind.SEARCH, Duration.ofSeconds(10));
        timeouts.put(EndpointKind.EXTRACT, Duration.ofSeconds(30));
        timeouts.put(EndpointKind.MAP, Duration.ofSeconds(20));
        timeouts.put(EndpointKind.CRAWL, Duration.ofSeconds(60));
        return timeouts;
    }

    public <T> Mono<T> execute(EndpointKind endpoint, Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            CircuitBreaker breaker = breakers.get(endpoint);
            final long permit;
            try {
                permit = breaker.acquirePermission();
            } catch (CircuitOpenException e) {
                log.warn("[Resilience] Fast fail. endpoint={} reason={}", endpoint.label(), e.getMessage());
                return Mono.error(e);
            }

            return attemptWithRetry(endpoint, call)
                .doOnSuccess(result -> breaker.onSuccess(permit))
                .doOnError(e -> breaker.onFailure(permit))
                .doOnCancel(() -> breaker.releasePermission(permit));
        });
    }

    public Map<EndpointKind, CircuitBreakerSnapshot> getCircuitBreakerStatus() {
        return breakers.statuses();
    }

    public void resetCircuitBreakers() {
        breakers.resetAll();
    }

    private <T> Mono<T> attemptWithRetry(EndpointKind endpoint, Supplier<Mono<T>> call) {
        Duration timeout = timeouts.getOrDefault(endpoint, Duration.ofSeconds(30));
        int maxAttempts = retryPolicy.maxRetries() + 1;

        return Mono.defer(call)
            .timeout(timeout, scheduler)
            .onErrorMap(TimeoutException.class, e -> new TransportException(endpoint,
                endpoint.label() + " timed out after " + timeout.toMillis() + "ms", e))
            .retryWhen(Retry.backoff(retryPolicy.maxRetries(), retryPolicy.baseDelay())
                .maxBackoff(retryPolicy.maxDelay())
                .jitter(retryPolicy.jitter())
                .scheduler(scheduler)
                .filter(ResilientRequestExecutor::isRetryable)
                .doBeforeRetry(signal -> log.warn("[Resilience] Attempt {}/{} failed, retrying. endpoint={} reason={}",
                    signal.totalRetries() + 1, maxAttempts, endpoint.label(), signal.failure().getMessage()))
                .onRetryExhaustedThrow((backoff, signal) -> {
                    log.error("[Resilience] All {} attempts failed. endpoint={}", maxAttempts, endpoint.label());
                    return signal.failure();
                }));
    }

    static boolean isRetryable(Throwable error) {
        return error instanceof TransportException transport && transport.isRetryable();
    }
}
