package org.adseller.server.buyer;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IdentityLevel {

    ANONYMOUS,
    SEAT_ONLY,
    AGENCY_ONLY,
    AGENCY_AND_ADVERTISER;

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
