package org.adseller.server.proposal.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.yield.model.CounterTerms;
import org.adseller.server.yield.model.Recommendation;

import java.time.Instant;
import java.util.List;

/**
 * Persisted decision of a single evaluation run.
 */
@Value
@Builder
public class ProposalDecision {

    String proposalId;

    ProposalStatus status;

    Recommendation recommendation;

    String decidedBy;

    CounterTerms counterTerms;

    String rejectionReason;

    List<String> errors;

    List<String> warnings;

    Instant decidedAt;
}
