package org.adseller.server.buyer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PaymentHistory {

    EXCELLENT,
    GOOD,
    FAIR,
    POOR,
    UNKNOWN;

    @JsonCreator
    public static PaymentHistory fromString(String value) {
        return value != null ? valueOf(value.toUpperCase(Locale.ROOT)) : UNKNOWN;
    }

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
