package com.packages.search.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.CancellationException;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the {@link CircuitBreakerRegistry} the multi-source feed draws one
 * {@link CircuitBreaker} per package source from. A source whose breaker is open is
 * reported as failed for the step without being queried; cancelled queries are not
 * counted as failures. No retry policy is configured: retrying is the caller's decision.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /**
     * Creates the global {@link CircuitBreakerRegistry} with the thresholds from
     * {@code packages.circuit-breaker}.
     *
     * @param properties bound search configuration
     * @return a registry whose default configuration applies to every source breaker
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(final PackageSearchProperties properties) {
        PackageSearchProperties.CircuitBreaker cb = properties.getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(cb.getFailureRateThreshold())
                .slidingWindowSize(cb.getSlidingWindowSize())
                .minimumNumberOfCalls(cb.getSlidingWindowSize())
                .waitDurationInOpenState(cb.getWaitDurationInOpenState())
                .ignoreExceptions(CancellationException.class)
                .build();
        return CircuitBreakerRegistry.of(config);
    }

}
