package com.researchplatform.webresearch.resilience;

import com.researchplatform.common.exception.CircuitOpenException;
import com.researchplatform.common.exception.SchemaValidationException;
import com.researchplatform.common.exception.TransportException;
import com.researchplatform.common.model.EndpointKind;
import com.researchplatform.webresearch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ResilientRequestExecutorTest {

    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(4), 0.0);

    private MutableClock clock;
    private CircuitBreakerRegistry registry;
    private ResilientRequestExecutor executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T09:15:00Z");
        registry = CircuitBreakerRegistry.withDefaults(clock);
        executor = new ResilientRequestExecutor(registry, FAST_RETRY,
            ResilientRequestExecutor.defaultTimeouts(), Schedulers.parallel());
    }

    private CircuitBreakerSnapshot search() {
        return executor.getCircuitBreakerStatus().get(EndpointKind.SEARCH);
    }

    @Test
    @DisplayName("transient 503s are retried until the call succeeds")
    void retriesTransientFailures() {
        AtomicInteger attempts = new AtomicInteger();

        Mono<String> call = executor.execute(EndpointKind.SEARCH, () -> attempts.incrementAndGet() < 3
            ? Mono.error(new TransportException(EndpointKind.SEARCH, 503, "unavailable"))
            : Mono.just("ok"));

        StepVerifier.create(call).expectNext("ok").verifyComplete();
        assertEquals(3, attempts.get());
        assertEquals(CircuitState.CLOSED, search().state());
        assertEquals(0, search().failureCount());
    }

    @Test
    @DisplayName("exhausted retries surface the last error and count as one breaker failure")
    void exhaustedRetriesCountOnce() {
        AtomicInteger attempts = new AtomicInteger();

        StepVerifier.create(executor.execute(EndpointKind.SEARCH, () -> {
                attempts.incrementAndGet();
                return Mono.error(new TransportException(EndpointKind.SEARCH, 500, "HTTP 500"));
            }))
            .expectErrorSatisfies(e -> assertEquals("HTTP 500", e.getMessage()))
            .verify(Duration.ofSeconds(5));

        assertEquals(4, attempts.get());
        assertEquals(1, search().failureCount());
    }

    @Test
    @DisplayName("client errors and schema failures are not retried")
    void nonRetryableFailures() {
        AtomicInteger attempts = new AtomicInteger();

        StepVerifier.create(executor.execute(EndpointKind.SEARCH, () -> {
                attempts.incrementAndGet();
                return Mono.error(new TransportException(EndpointKind.SEARCH, 401, "unauthorized"));
            }))
            .expectError(TransportException.class)
            .verify(Duration.ofSeconds(5));

        StepVerifier.create(executor.execute(EndpointKind.SEARCH, () -> {
                attempts.incrementAndGet();
                return Mono.error(new SchemaValidationException(EndpointKind.SEARCH, List.of("query: required")));
            }))
            .expectError(SchemaValidationException.class)
            .verify(Duration.ofSeconds(5));

        assertEquals(2, attempts.get());
        assertEquals(2, search().failureCount());
    }

    @Test
    @DisplayName("an open breaker fails fast without invoking the call")
    void openBreakerFailsFast() {
        for (int i = 0; i < 5; i++) {
            StepVerifier.create(executor.execute(EndpointKind.SEARCH,
                    () -> Mono.error(new TransportException(EndpointKind.SEARCH, 400, "bad request"))))
                .expectError(TransportException.class)
                .verify(Duration.ofSeconds(5));
        }
        AtomicInteger attempts = new AtomicInteger();

        StepVerifier.create(executor.execute(EndpointKind.SEARCH, () -> {
                attempts.incrementAndGet();
                return Mono.just("never");
            }))
            .expectError(CircuitOpenException.class)
            .verify(Duration.ofSeconds(5));

        assertEquals(0, attempts.get());
        assertEquals(CircuitState.CLOSED, executor.getCircuitBreakerStatus().get(EndpointKind.EXTRACT).state());

        executor.resetCircuitBreakers();
        assertEquals(CircuitState.CLOSED, search().state());
    }

    @Test
    @DisplayName("a slow call finishing after the breaker opened does not close it")
    void lateSuccessDoesNotCloseBreaker() {
        Sinks.One<String> slow = Sinks.one();
        AtomicReference<String> slowResult = new AtomicReference<>();
        executor.execute(EndpointKind.EXTRACT, slow::asMono).subscribe(slowResult::set);

        for (int i = 0; i < 5; i++) {
            StepVerifier.create(executor.execute(EndpointKind.EXTRACT,
                    () -> Mono.error(new TransportException(EndpointKind.EXTRACT, 400, "bad request"))))
                .expectError(TransportException.class)
                .verify(Duration.ofSeconds(5));
        }
        assertEquals(CircuitState.OPEN, executor.getCircuitBreakerStatus().get(EndpointKind.EXTRACT).state());

        slow.tryEmitValue("late");
        assertEquals("late", slowResult.get());
        assertEquals(CircuitState.OPEN, executor.getCircuitBreakerStatus().get(EndpointKind.EXTRACT).state());

        AtomicInteger invoked = new AtomicInteger();
        StepVerifier.create(executor.execute(EndpointKind.EXTRACT, () -> {
                invoked.incrementAndGet();
                return Mono.just("x");
            }))
            .expectError(CircuitOpenException.class)
            .verify(Duration.ofSeconds(5));
        assertEquals(0, invoked.get());
    }

    @Test
    @DisplayName("a call exceeding the endpoint timeout fails as a network error")
    void endpointTimeout() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        try {
            ResilientRequestExecutor timed = new ResilientRequestExecutor(registry, RetryPolicy.none(),
                ResilientRequestExecutor.defaultTimeouts(), scheduler);

            StepVerifier.create(timed.execute(EndpointKind.SEARCH, Mono::<String>never))
                .then(() -> scheduler.advanceTimeBy(Duration.ofSeconds(10)))
                .expectErrorSatisfies(e -> {
                    TransportException transport = assertInstanceOf(TransportException.class, e);
                    assertTrue(transport.isNetworkError());
                    assertEquals("search timed out after 10000ms", transport.getMessage());
                })
                .verify(Duration.ofSeconds(5));
        } finally {
            scheduler.dispose();
        }
    }
}
