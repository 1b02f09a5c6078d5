package org.adseller.server.proposal.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProposalStatus {

    RECEIVED,
    EVALUATING,
    COUNTER_PENDING,
    ACCEPTED,
    REJECTED,
    FAILED;

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
