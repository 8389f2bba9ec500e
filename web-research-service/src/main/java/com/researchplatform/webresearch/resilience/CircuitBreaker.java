package com.researchplatform.webresearch.resilience;

import com.researchplatform.common.exception.CircuitOpenException;
import com.researchplatform.common.model.EndpointKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Three-state breaker guarding one endpoint.
 *
 * <ul>
 *   <li>CLOSED: failures are timestamped into a sliding window of {@code failureWindow};
 *       reaching {@code failureThreshold} inside it opens the breaker. A success clears it.</li>
 *   <li>OPEN: every permission request fails with {@link CircuitOpenException} until
 *       {@code coolDown} has elapsed since opening; the next request becomes the trial.</li>
 *   <li>HALF_OPEN: exactly one trial is in flight. Its success closes the breaker, its failure
 *       re-opens it with a fresh cool-down. Concurrent callers are rejected.</li>
 * </ul>
 *
 * Callers must pair every granted {@link #acquirePermission()} with exactly one of
 * {@link #onSuccess(long)}, {@link #onFailure(long)} or {@link #releasePermission(long)},
 * passing back the permit it returned. Every state change starts a new generation; an
 * outcome reported with a permit from an older generation is ignored, so a slow call admitted
 * before the breaker opened cannot close it or disturb a half-open trial.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final EndpointKind endpoint;
    private final CircuitBreakerPolicy policy;
    private final Clock clock;

    private final Deque<Instant> failures = new ArrayDeque<>();
    private CircuitState state = CircuitState.CLOSED;
    private Instant lastFailureAt;
    private Instant openedAt;
    private boolean trialInFlight;
    private long generation;

    public CircuitBreaker(EndpointKind endpoint, CircuitBreakerPolicy policy, Clock clock) {
        this.endpoint = endpoint;
        this.policy   = policy;
        this.clock    = clock;
    }

    /** Returns the permit to report the call's outcome with. */
    public synchronized long acquirePermission() {
        Instant now = clock.instant();
        switch (state) {
            case CLOSED -> { }
            case OPEN -> {
                Instant nextAttemptAt = openedAt.plus(policy.coolDown());
                if (now.isBefore(nextAttemptAt)) {
                    throw new CircuitOpenException(endpoint, nextAttemptAt);
                }
                transitionTo(CircuitState.HALF_OPEN);
                trialInFlight = true;
                log.info("[CircuitBreaker] Moving to HALF_OPEN. endpoint={}", endpoint.label());
            }
            case HALF_OPEN -> {
                if (trialInFlight) {
                    throw new CircuitOpenException(endpoint);
                }
                trialInFlight = true;
            }
        }
        return generation;
    }

    public synchronized void onSuccess(long permit) {
        if (isStale(permit, "success")) {
            return;
        }
        if (state == CircuitState.HALF_OPEN) {
            log.info("[CircuitBreaker] Trial succeeded, moving to CLOSED. endpoint={}", endpoint.label());
            transitionTo(CircuitState.CLOSED);
        }
        trialInFlight = false;
        failures.clear();
        openedAt = null;
    }

    public synchronized void onFailure(long permit) {
        if (isStale(permit, "failure")) {
            return;
        }
        Instant now = clock.instant();
        lastFailureAt = now;

        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            open(now);
            return;
        }

        failures.addLast(now);
        evictOutsideWindow(now);
        if (failures.size() >= policy.failureThreshold()) {
            open(now);
        }
    }

    /** Gives back a granted permission without recording an outcome, e.g. on cancellation. */
    public synchronized void releasePermission(long permit) {
        if (permit == generation && state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        evictOutsideWindow(clock.instant());
        Instant nextAttemptAt = state == CircuitState.OPEN ? openedAt.plus(policy.coolDown()) : null;
        return new CircuitBreakerSnapshot(state, failures.size(), lastFailureAt, openedAt, nextAttemptAt);
    }

    public synchronized void reset() {
        transitionTo(CircuitState.CLOSED);
        failures.clear();
        lastFailureAt = null;
        openedAt = null;
        trialInFlight = false;
    }

    private void open(Instant now) {
        transitionTo(CircuitState.OPEN);
        openedAt = now;
        log.error("[CircuitBreaker] Moving to OPEN. endpoint={} failures={} nextAttemptAt={}",
                  endpoint.label(), failures.size(), now.plus(policy.coolDown()));
    }

    private void transitionTo(CircuitState next) {
        state = next;
        generation++;
    }

    // outcome of a call admitted under an earlier state
    private boolean isStale(long permit, String outcome) {
        if (permit == generation) {
            return false;
        }
        log.debug("[CircuitBreaker] Ignoring late {}. endpoint={} permit={} generation={}",
                  outcome, endpoint.label(), permit, generation);
        return true;
    }

    private void evictOutsideWindow(Instant now) {
        Instant windowStart = now.minus(policy.failureWindow());
        while (!failures.isEmpty() && failures.peekFirst().isBefore(windowStart)) {
            failures.removeFirst();
        }
    }
}
