package org.adseller.server.proposal.advisor;

import io.vertx.core.Future;
import org.adseller.server.execution.Timeout;
import org.adseller.server.proposal.model.ProposalEvaluation;
import org.adseller.server.proposal.model.ProposalRequest;
import org.adseller.server.yield.model.Recommendation;

/**
 * Strategy deciding whether an evaluated proposal is accepted, countered or rejected.
 */
public interface ProposalAdvisor {

    Future<Recommendation> advise(ProposalRequest request, ProposalEvaluation evaluation, Timeout timeout);

    String name();
}
