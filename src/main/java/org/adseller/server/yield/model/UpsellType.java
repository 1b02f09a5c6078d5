package org.adseller.server.yield.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UpsellType {

    VOLUME_UPGRADE,
    CROSS_SELL,
    COMMITMENT_BONUS,
    ALTERNATIVE_PRODUCT;

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
