package com.researchplatform.webresearch.ratelimit;

import com.researchplatform.common.exception.RateLimitExceededException;
import com.researchplatform.common.exception.RateLimitQueueFullException;
import com.researchplatform.common.exception.RateLimitTimeoutException;
import com.researchplatform.common.exception.ResearchClientException;
import com.researchplatform.webresearch.config.ThroughputTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Process-wide token bucket in front of every upstream research call.
 *
 * <p><strong>Refill:</strong> {@code elapsedMinutes × refillRate} tokens, floored and capped at
 * capacity. {@code lastRefillAt} only moves when at least one whole token was added, so
 * frequent calls cannot starve the bucket through sub-token updates.
 *
 * <p><strong>Waiting:</strong> callers that find the bucket empty join a bounded FIFO queue.
 * Instead of polling, the limiter arms a single wake-up for the instant the next whole token
 * accrues; the wake-up refills and hands tokens to the oldest waiters first. A waiter still
 * queued after {@code queueTimeout} is removed and fails with {@link RateLimitTimeoutException}.
 * A full queue fails fast with {@link RateLimitQueueFullException}.
 *
 * <p>All state is guarded by this instance's monitor. Sinks are always signalled after the
 * monitor is released so downstream operators never run inside the critical section.
 * Time comes from the supplied {@link Scheduler}, which lets tests drive the bucket with
 * virtual time.
 */
public class TokenBucketRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    public static final int DEFAULT_MAX_QUEUE_SIZE = 100;
    public static final Duration DEFAULT_QUEUE_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_BATCH_CONCURRENCY = 5;

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final String tier;
    private final int capacity;
    private final double refillRatePerMinute;
    private final int maxQueueSize;
    private final Duration queueTimeout;
    private final Scheduler scheduler;

    private final Deque<Waiter> queue = new ArrayDeque<>();
    private int tokens;
    private long lastRefillAtMs;
    private Disposable pendingWakeUp;

    public TokenBucketRateLimiter(ThroughputTier tier, int maxQueueSize, Duration queueTimeout, Scheduler scheduler) {
        this(tier.name(), tier.capacity(), tier.requestsPerMinute(), maxQueueSize, queueTimeout, scheduler);
    }

    public TokenBucketRateLimiter(String tier, int capacity, double refillRatePerMinute,
                                  int maxQueueSize, Duration queueTimeout, Scheduler scheduler) {
        if (capacity <= 0 || refillRatePerMinute <= 0) {
            throw new IllegalArgumentException("capacity and refillRatePerMinute must be positive");
        }
        this.tier                = tier;
        this.capacity            = capacity;
        this.refillRatePerMinute = refillRatePerMinute;
        this.maxQueueSize        = maxQueueSize;
        this.queueTimeout        = queueTimeout;
        this.scheduler           = scheduler;
        this.tokens              = capacity;
        this.lastRefillAtMs      = now();
        log.info("[RateLimiter] Initialized. tier={} capacity={} refillPerMinute={} maxQueueSize={}",
                 tier, capacity, refillRatePerMinute, maxQueueSize);
    }

    // ── public API ──────────────────────────────────────────────────────────

    /**
     * Completes once a token has been consumed on behalf of the subscriber. Lazy: nothing
     * happens until subscription. Cancelling while queued gives up the queue slot.
     */
    public Mono<Void> acquire() {
        return Mono.create(sink -> {
            List<Waiter> granted;
            Waiter queued = null;
            boolean immediate = false;
            int queueSize;

            synchronized (this) {
                refill();
                granted = grantWaiters();
                if (queue.isEmpty() && tokens > 0) {
                    tokens--;
                    immediate = true;
                } else if (queue.size() < maxQueueSize) {
                    queued = enqueue(sink);
                }
                queueSize = queue.size();
            }

            complete(granted);

            if (immediate) {
                sink.success();
            } else if (queued != null) {
                Waiter waiter = queued;
                sink.onCancel(() -> abandon(waiter));
                log.info("[RateLimiter] Request queued. queueSize={}", queueSize);
            } else {
                log.warn("[RateLimiter] Queue full, rejecting request. maxQueueSize={}", maxQueueSize);
                sink.error(new RateLimitQueueFullException(maxQueueSize));
            }
        });
    }

    /** Consumes a token only if one is free right now. Never queues. */
    public boolean tryAcquire() {
        List<Waiter> granted;
        boolean acquired = false;
        synchronized (this) {
            refill();
            granted = grantWaiters();
            if (queue.isEmpty() && tokens > 0) {
                tokens--;
                acquired = true;
            }
        }
        complete(granted);
        return acquired;
    }

    public RateLimiterStatus getStatus() {
        List<Waiter> granted;
        RateLimiterStatus status;
        synchronized (this) {
            refill();
            granted = grantWaiters();
            status = new RateLimiterStatus(tier, tokens, capacity, refillRatePerMinute, queue.size(),
                ((capacity - tokens) / (double) capacity) * 100.0);
        }
        complete(granted);
        return status;
    }

    /** Refills the bucket and fails every queued waiter. Intended for tests and manual recovery. */
    public void reset() {
        List<Waiter> rejected;
        synchronized (this) {
            tokens = capacity;
            lastRefillAtMs = now();
            rejected = new ArrayList<>(queue);
            queue.clear();
            rejected.forEach(Waiter::cancelTimeout);
            cancelWakeUp();
        }
        rejected.forEach(w -> w.sink.error(new ResearchClientException(null, "Rate limiter reset")));
        log.info("[RateLimiter] Reset. rejectedWaiters={}", rejected.size());
    }

    /**
     * Runs {@code call} after obtaining a token. With {@code skipQueue} the call fails with
     * {@link RateLimitExceededException} instead of waiting when no token is free.
     */
    public <T> Mono<T> rateLimited(Supplier<Mono<T>> call, boolean skipQueue) {
        if (skipQueue) {
            return Mono.defer(() -> tryAcquire()
                ? call.get()
                : Mono.error(new RateLimitExceededException()));
        }
        return acquire().then(Mono.defer(call));
    }

    /**
     * Runs {@code call} for every item, {@code concurrency} items at a time, each under the
     * limiter. Failed items are logged and dropped; successful results keep input order.
     */
    public <T, R> Mono<List<R>> rateLimitedBatch(List<T> items, Function<T, Mono<R>> call, int concurrency) {
        int chunkSize = Math.max(1, concurrency);
        AtomicInteger failures = new AtomicInteger();

        return Flux.fromIterable(items)
            .buffer(chunkSize)
            .concatMap(chunk -> Flux.fromIterable(chunk)
                .flatMapSequential(item -> rateLimited(() -> call.apply(item), false)
                    .map(Optional::of)
                    .onErrorResume(e -> {
                        failures.incrementAndGet();
                        log.error("[RateLimitedBatch] Item failed. item={} reason={}", item, e.getMessage());
                        return Mono.just(Optional.empty());
                    })))
            .filter(Optional::isPresent)
            .map(Optional::get)
            .collectList()
            .doOnSuccess(results -> {
                if (failures.get() > 0) {
                    log.warn("[RateLimitedBatch] {}/{} requests failed", failures.get(), items.size());
                }
            });
    }

    // ── bucket mechanics (caller holds the monitor) ──────────────────────────

    private void refill() {
        long now = now();
        double tokensToAdd = ((now - lastRefillAtMs) * refillRatePerMinute) / MILLIS_PER_MINUTE;
        if (tokensToAdd >= 1) {
            tokens = (int) Math.min(capacity, tokens + Math.floor(tokensToAdd));
            lastRefillAtMs = now;
        }
    }

    private List<Waiter> grantWaiters() {
        if (queue.isEmpty() || tokens == 0) {
            return List.of();
        }
        List<Waiter> granted = new ArrayList<>();
        while (!queue.isEmpty() && tokens > 0) {
            Waiter waiter = queue.pollFirst();
            waiter.cancelTimeout();
            tokens--;
            granted.add(waiter);
        }
        if (queue.isEmpty()) {
            cancelWakeUp();
        }
        return granted;
    }

    private Waiter enqueue(MonoSink<Void> sink) {
        Waiter waiter = new Waiter(sink, now());
        queue.addLast(waiter);
        waiter.timeout = scheduler.schedule(() -> expire(waiter), queueTimeout.toMillis(), TimeUnit.MILLISECONDS);
        armWakeUp();
        return waiter;
    }

    private void armWakeUp() {
        if (pendingWakeUp != null && !pendingWakeUp.isDisposed()) {
            return;
        }
        double millisPerToken = MILLIS_PER_MINUTE / refillRatePerMinute;
        long delay = Math.max(1L, (long) Math.ceil(millisPerToken - (now() - lastRefillAtMs)));
        pendingWakeUp = scheduler.schedule(this::onWakeUp, delay, TimeUnit.MILLISECONDS);
    }

    private void cancelWakeUp() {
        if (pendingWakeUp != null) {
            pendingWakeUp.dispose();
            pendingWakeUp = null;
        }
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    // ── scheduled callbacks ──────────────────────────────────────────────────

    private void onWakeUp() {
        List<Waiter> granted;
        synchronized (this) {
            pendingWakeUp = null;
            refill();
            granted = grantWaiters();
            if (!queue.isEmpty()) {
                armWakeUp();
            }
        }
        complete(granted);
    }

    private void expire(Waiter waiter) {
        boolean removed;
        synchronized (this) {
            removed = queue.remove(waiter);
            if (queue.isEmpty()) {
                cancelWakeUp();
            }
        }
        if (removed) {
            log.warn("[RateLimiter] Queued request timed out. waitedMs={}", now() - waiter.enqueuedAtMs);
            waiter.sink.error(new RateLimitTimeoutException(queueTimeout));
        }
    }

    private void abandon(Waiter waiter) {
        synchronized (this) {
            if (queue.remove(waiter)) {
                waiter.cancelTimeout();
                if (queue.isEmpty()) {
                    cancelWakeUp();
                }
            }
        }
    }

    private static void complete(List<Waiter> granted) {
        granted.forEach(w -> w.sink.success());
    }

    private static final class Waiter {
        private final MonoSink<Void> sink;
        private final long enqueuedAtMs;
        private Disposable timeout;

        private Waiter(MonoSink<Void> sink, long enqueuedAtMs) {
            this.sink         = sink;
            this.enqueuedAtMs = enqueuedAtMs;
        }

        private void cancelTimeout() {
            if (timeout != null) {
                timeout.dispose();
            }
        }
    }
}
