package org.adseller.server.proposal.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EvaluationStage {

    RECEIVED,
    PRODUCT_VALIDATED,
    AUDIENCE_VALIDATED,
    PRICING_EVALUATED,
    AVAILABILITY_CHECKED,
    SCORED,
    DECIDED,
    COUNTER_TERMS_GENERATED,
    UPSELL_IDENTIFIED,
    FINALIZED,
    FAILED;

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
