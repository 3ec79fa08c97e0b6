package com.insightengine.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.insightengine.core.error.InvalidInputException;
import com.insightengine.core.model.MetricSeries;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON codec for the engine's value types.
 *
 * <p>
 * Timestamps are ISO-8601 strings and enums use their lower-case wire names,
 * e.g. {@code "anomalyType":"sudden_drop"}. Unknown properties in inbound
 * payloads are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class InsightJson {

    private static final ObjectMapper MAPPER = createMapper();

    private InsightJson() {
        // utility class
    }

    /**
     * @return the shared, fully configured mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @param value any engine value type
     * @return JSON text
     * @throws UncheckedIOException if the value cannot be serialized
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * @param value any engine value type
     * @return UTF-8 JSON bytes
     * @throws UncheckedIOException if the value cannot be serialized
     */
    public static byte[] toBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parse a metric series payload:
     *
     * <pre>
     * {"metricName":"success_rate","points":[{"timestamp":"2024-01-01T00:00:00Z","value":0.98}]}
     * </pre>
     *
     * @param json payload
     * @return parsed series
     * @throws InvalidInputException if the payload is malformed or holds a
     *                               non-finite value
     */
    public static MetricSeries readSeries(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return MAPPER.readValue(json, MetricSeries.class);
        } catch (IOException e) {
            throw malformed(e);
        }
    }

    public static MetricSeries readSeries(byte[] json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return MAPPER.readValue(json, MetricSeries.class);
        } catch (IOException e) {
            throw malformed(e);
        }
    }

    private static InvalidInputException malformed(IOException e) {
        // a non-finite value rejected by the constructor arrives wrapped
        if (e.getCause() instanceof InvalidInputException invalid) {
            return invalid;
        }
        return new InvalidInputException("Malformed metric series payload: " + e.getMessage(), e);
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
