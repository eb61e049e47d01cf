package com.packages.search.telemetry;

/**
 * Receives telemetry events. Delivery and durability are up to the implementation.
 */
@FunctionalInterface
public interface TelemetryService {

    void emit(TelemetryEvent event);
}
