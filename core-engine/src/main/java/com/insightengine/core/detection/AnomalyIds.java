package com.insightengine.core.detection;

import com.insightengine.core.model.AnomalyType;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Name-based anomaly identifiers: the same metric, type and timestamp always
 * yield the same id.
 */
public final class AnomalyIds {

    private AnomalyIds() {
        // utility class
    }

    public static String of(String metricName, AnomalyType type, Instant detectedAt) {
        String key = metricName + '|' + type.wireName() + '|' + detectedAt;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
