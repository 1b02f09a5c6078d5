package org.adseller.server.proposal.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.audience.model.AudienceValidationResult;
import org.adseller.server.catalog.model.ProductDefinition;
import org.adseller.server.execution.Timeout;

import java.time.Instant;
import java.util.List;

/**
 * State of one evaluation run. Stages, errors and warnings are collected in place while the run progresses and
 * are never shared between runs.
 */
@Value
@Builder(toBuilder = true)
public class EvaluationContext {

    ProposalRequest request;

    Timeout timeout;

    Instant receivedAt;

    ProductDefinition product;

    ProposalEvaluation evaluation;

    AudienceValidationResult audienceValidation;

    ProposalStatus status;

    String decidedBy;

    List<EvaluationStage> stages;

    List<String> errors;

    List<String> warnings;

    public EvaluationContext with(ProposalEvaluation evaluation) {
        return toBuilder().evaluation(evaluation).build();
    }

    public EvaluationContext with(ProductDefinition product) {
        return toBuilder().product(product).build();
    }

    public EvaluationContext with(AudienceValidationResult audienceValidation) {
        return toBuilder().audienceValidation(audienceValidation).build();
    }
}
