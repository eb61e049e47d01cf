package com.packages.search.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the search engine configuration from <code>application.yml</code>
 * under the <code>packages</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * packages:
 *   sources:
 *     - name: local-mirror
 *       location: classpath:catalogs/local-mirror.json
 *       page-size: 25
 *   telemetry:
 *     enabled: true
 *     default-catalog-host: api.nuget.org
 *   circuit-breaker:
 *     failure-rate-threshold: 50
 * }</pre>
 */
@Validated
@ConfigurationProperties(prefix = "packages")
@Getter
@Setter
public class PackageSearchProperties {

    /**
     * Package sources in priority order.
     */
    @Valid
    private List<PackageSourceCfg> sources = new ArrayList<>();

    @Valid
    private Telemetry telemetry = new Telemetry();

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Data
    public static class Telemetry {

        /** Whether search telemetry events are emitted at all */
        private boolean enabled = true;

        /** Host that identifies the default public catalog in source summaries */
        private String defaultCatalogHost = "api.nuget.org";
    }

    @Data
    public static class CircuitBreaker {

        /** Failure percentage that opens a source's breaker */
        @DecimalMin("1.0")
        @DecimalMax("100.0")
        private float failureRateThreshold = 50.0f;

        /** Number of calls recorded per source */
        @Min(1)
        private int slidingWindowSize = 10;

        /** How long an open breaker rejects calls before probing again */
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }
}
