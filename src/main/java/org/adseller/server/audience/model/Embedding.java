package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Fixed-dimension vector describing audience or inventory characteristics.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Embedding {

    EmbeddingType embeddingType;

    SignalType signalType;

    List<Double> vector;

    /**
     * Declared vector size, the vector's own size applies when absent.
     */
    Integer dimension;

    ModelDescriptor modelDescriptor;

    ContextDescriptor context;

    Consent consent;

    Instant timestamp;

    @Builder.Default
    long ttlSeconds = 3600;

    public int effectiveDimension() {
        if (dimension != null) {
            return dimension;
        }
        return vector != null ? vector.size() : 0;
    }

    public boolean isExpired(Clock clock) {
        return timestamp != null && clock.instant().isAfter(timestamp.plusSeconds(ttlSeconds));
    }
}
