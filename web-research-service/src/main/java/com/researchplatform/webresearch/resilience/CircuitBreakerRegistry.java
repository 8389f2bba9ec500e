package com.researchplatform.webresearch.resilience;

import com.researchplatform.common.model.EndpointKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** One independent breaker per endpoint kind. A tripped extract breaker never blocks search. */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<EndpointKind, CircuitBreaker> breakers = new EnumMap<>(EndpointKind.class);

    public CircuitBreakerRegistry(Map<EndpointKind, CircuitBreakerPolicy> policies, Clock clock) {
        for (EndpointKind endpoint : EndpointKind.values()) {
            CircuitBreakerPolicy policy = policies.get(endpoint);
            if (policy == null) {
                throw new IllegalArgumentException("No circuit breaker policy for " + endpoint.label());
            }
            breakers.put(endpoint, new CircuitBreaker(endpoint, policy, clock));
        }
    }

    /** Search/extract get the interactive policy, map/crawl the bulk one. */
    public static CircuitBreakerRegistry withDefaults(Clock clock) {
        Map<EndpointKind, CircuitBreakerPolicy> policies = new EnumMap<>(EndpointKind.class);
        policies.put(EndpointKind.SEARCH, CircuitBreakerPolicy.interactive());
        policies.put(EndpointKind.EXTRACT, CircuitBreakerPolicy.interactive());
        policies.put(EndpointKind.MAP, CircuitBreakerPolicy.bulk());
        policies.put(EndpointKind.CRAWL, CircuitBreakerPolicy.bulk());
        return new CircuitBreakerRegistry(policies, clock);
    }

    public CircuitBreaker get(EndpointKind endpoint) {
        return breakers.get(endpoint);
    }

    public Map<EndpointKind, CircuitBreakerSnapshot> statuses() {
        Map<EndpointKind, CircuitBreakerSnapshot> statuses = new EnumMap<>(EndpointKind.class);
        breakers.forEach((endpoint, breaker) -> statuses.put(endpoint, breaker.snapshot()));
        return Collections.unmodifiableMap(statuses);
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("[CircuitBreaker] All circuit breakers reset");
    }
}
