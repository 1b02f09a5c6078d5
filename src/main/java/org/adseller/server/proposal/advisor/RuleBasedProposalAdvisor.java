package org.adseller.server.proposal.advisor;

import io.vertx.core.Future;
import org.adseller.server.execution.Timeout;
import org.adseller.server.proposal.model.ProposalEvaluation;
import org.adseller.server.proposal.model.ProposalRequest;
import org.adseller.server.yield.model.Recommendation;

/**
 * Deterministic decision used whenever no other advisor is available: accept when price, availability and
 * targeting all check out, counter when inventory is available, reject otherwise.
 */
public class RuleBasedProposalAdvisor implements ProposalAdvisor {

    public static final String NAME = "rule_based";

    @Override
    public Future<Recommendation> advise(ProposalRequest request, ProposalEvaluation evaluation, Timeout timeout) {
        return Future.succeededFuture(decide(evaluation));
    }

    public Recommendation decide(ProposalEvaluation evaluation) {
        if (evaluation.isPriceAcceptable()
                && evaluation.isImpressionsAvailable()
                && evaluation.isTargetingCompatible()) {
            return Recommendation.ACCEPT;
        } else if (evaluation.isImpressionsAvailable()) {
            return Recommendation.COUNTER;
        }
        return Recommendation.REJECT;
    }

    @Override
    public String name() {
        return NAME;
    }
}
