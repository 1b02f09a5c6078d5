package org.adseller.server.buyer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Buyer access tiers ordered by increasing price disclosure.
 */
public enum AccessTier {

    PUBLIC,
    SEAT,
    AGENCY,
    ADVERTISER;

    @JsonCreator
    public static AccessTier fromString(String value) {
        return value != null ? valueOf(value.toUpperCase(Locale.ROOT)) : null;
    }

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
