package org.adseller.server.deal.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the buyer is expected to activate a deal: through an agent or by entering the deal id in a DSP.
 */
public enum ActivationType {

    AGENTIC,
    TRADITIONAL_DSP;

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
