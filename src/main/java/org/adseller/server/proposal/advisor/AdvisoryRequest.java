package org.adseller.server.proposal.advisor;

import lombok.Value;
import org.adseller.server.proposal.model.ProposalEvaluation;

import java.time.LocalDate;

@Value(staticConstructor = "of")
public class AdvisoryRequest {

    String proposalId;

    String dealType;

    LocalDate startDate;

    LocalDate endDate;

    ProposalEvaluation evaluation;
}
