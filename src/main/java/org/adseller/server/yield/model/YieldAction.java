package org.adseller.server.yield.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum YieldAction {

    COUNTER,
    UPSELL,
    NONE;

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
