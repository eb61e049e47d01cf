package com.packages.search.telemetry;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telemetry sink that writes every event to the application log.
 * PII values are never logged, only their keys.
 */
@Slf4j
public class LoggingTelemetryService implements TelemetryService {

    private static final String REDACTED = "<redacted>";

    @Override
    public void emit(final TelemetryEvent event) {
        Map<String, Object> pii = new LinkedHashMap<>();
        event.getPiiData().keySet().forEach(k -> pii.put(k, REDACTED));
        log.info("telemetry event={} properties={} pii={}", event.getName(), event.getProperties(), pii);
    }
}
