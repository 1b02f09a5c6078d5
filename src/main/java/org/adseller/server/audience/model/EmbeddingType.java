package org.adseller.server.audience.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EmbeddingType {

    CONTEXT,
    CREATIVE,
    USER_INTENT,
    INVENTORY,
    QUERY;

    @JsonCreator
    public static EmbeddingType fromString(String value) {
        return value != null ? valueOf(value.toUpperCase(Locale.ROOT)) : null;
    }

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
