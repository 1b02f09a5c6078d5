package org.adseller.server.audience.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SimilarityMetric {

    COSINE,
    DOT,
    L2;

    @JsonCreator
    public static SimilarityMetric fromString(String value) {
        return value != null ? valueOf(value.toUpperCase(Locale.ROOT)) : null;
    }

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
