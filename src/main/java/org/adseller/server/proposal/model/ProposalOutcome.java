package org.adseller.server.proposal.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.audience.model.AudienceValidationResult;

import java.time.Instant;
import java.util.List;

/**
 * Terminal result of evaluating one proposal. Evaluation is absent when the proposal failed input validation.
 */
@Value
@Builder(toBuilder = true)
public class ProposalOutcome {

    String proposalId;

    ProposalStatus status;

    List<EvaluationStage> stages;

    ProposalEvaluation evaluation;

    AudienceValidationResult audienceValidation;

    List<String> errors;

    List<String> warnings;

    /**
     * Name of the advisor strategy that produced the decision.
     */
    String decidedBy;

    Instant receivedAt;

    Instant completedAt;

    public boolean isFailed() {
        return status == ProposalStatus.FAILED;
    }
}
