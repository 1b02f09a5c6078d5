package org.adseller.server.yield.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Recommendation {

    ACCEPT,
    COUNTER,
    REJECT;

    @JsonCreator
    public static Recommendation fromString(String value) {
        return value != null ? valueOf(value.trim().toUpperCase(Locale.ROOT)) : null;
    }

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
