package org.adseller.server.deal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

public enum DealType {

    PROGRAMMATIC_GUARANTEED("programmaticguaranteed"),
    PREFERRED_DEAL("preferreddeal"),
    PRIVATE_AUCTION("privateauction");

    private final String value;

    DealType(String value) {
        this.value = value;
    }

    /**
     * Resolves deal type from its canonical value, enum name or short alias (pg, pd, pa).
     * Returns null for unknown values.
     */
    @JsonCreator
    public static DealType fromString(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }

        final String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "_");
        return switch (normalized) {
            case "pg", "programmatic_guaranteed", "programmaticguaranteed" -> PROGRAMMATIC_GUARANTEED;
            case "pd", "preferred_deal", "preferreddeal" -> PREFERRED_DEAL;
            case "pa", "private_auction", "privateauction" -> PRIVATE_AUCTION;
            default -> null;
        };
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
