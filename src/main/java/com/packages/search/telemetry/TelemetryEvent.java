package com.packages.search.telemetry;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named, structured telemetry event.
 * <p>
 * Values are limited to strings, numbers and booleans. Values that identify a user or
 * carry user input (search text) go into the PII map so sinks can redact or hash them.
 * </p>
 */
public class TelemetryEvent {

    @Getter
    private final String name;

    private final Map<String, Object> properties = new LinkedHashMap<>();

    private final Map<String, Object> piiProperties = new LinkedHashMap<>();

    public TelemetryEvent(final String name) {
        this.name = name;
    }

    /**
     * @param key   property name
     * @param value string, number or boolean
     * @return this event
     */
    public TelemetryEvent with(final String key, final Object value) {
        properties.put(key, checked(key, value));
        return this;
    }

    /**
     * @param key   property name
     * @param value string, number or boolean that must be treated as personal data
     * @return this event
     */
    public TelemetryEvent withPii(final String key, final Object value) {
        piiProperties.put(key, checked(key, value));
        return this;
    }

    /**
     * @param key property name
     * @return the non-PII value, or {@code null}
     */
    public Object get(final String key) {
        return properties.get(key);
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Map<String, Object> getPiiData() {
        return Collections.unmodifiableMap(piiProperties);
    }

    private static Object checked(final String key, final Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        throw new IllegalArgumentException("Telemetry property " + key
                + " must be a string, number or boolean but was " + value);
    }

    @Override
    public String toString() {
        return name + properties;
    }
}
