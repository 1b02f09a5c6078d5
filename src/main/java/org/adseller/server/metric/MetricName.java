package org.adseller.server.metric;

public enum MetricName {

    // proposals
    proposals_received("proposals.received"),
    proposals_failed("proposals.failed"),
    proposals_accepted("proposals.accepted"),
    proposals_countered("proposals.countered"),
    proposals_rejected("proposals.rejected"),
    proposal_evaluation_time("proposals.evaluation_time"),

    // collaborator fallbacks
    audience_validation_fallback("fallback.audience"),
    availability_fallback("fallback.availability"),
    advisor_fallback("fallback.advisor"),
    persistence_failure("fallback.persistence"),

    // deals
    deals_created("deals.created");

    private final String name;

    MetricName(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
