package org.adseller.server.deal;

import io.vertx.core.Future;
import org.adseller.server.deal.model.ActivationType;
import org.adseller.server.deal.model.DealCreationResult;
import org.adseller.server.exception.SellerException;
import org.adseller.server.execution.TimeoutExecutor;
import org.adseller.server.execution.TimeoutFactory;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.log.Logger;
import org.adseller.server.log.LoggerFactory;
import org.adseller.server.metric.MetricName;
import org.adseller.server.metric.Metrics;
import org.adseller.server.proposal.model.ProposalEvaluation;
import org.adseller.server.proposal.model.ProposalOutcome;
import org.adseller.server.proposal.model.ProposalRequest;
import org.adseller.server.proposal.model.ProposalStatus;
import org.adseller.server.storage.EvaluationStore;
import org.adseller.server.storage.RecordType;
import org.adseller.server.storage.StoredRecord;
import org.adseller.server.yield.model.CounterTerms;
import org.apache.commons.lang3.ObjectUtils;

import java.time.Clock;
import java.util.Objects;

/**
 * Creates deals for accepted proposals and for countered proposals whose counter terms the buyer accepted.
 */
public class DealService {

    private static final Logger logger = LoggerFactory.getLogger(DealService.class);

    private final DealRecordBuilder dealRecordBuilder;
    private final EvaluationStore evaluationStore;
    private final TimeoutExecutor timeoutExecutor;
    private final TimeoutFactory timeoutFactory;
    private final long persistenceTimeoutMs;
    private final JacksonMapper mapper;
    private final Metrics metrics;
    private final Clock clock;

    public DealService(DealRecordBuilder dealRecordBuilder,
                       EvaluationStore evaluationStore,
                       TimeoutExecutor timeoutExecutor,
                       TimeoutFactory timeoutFactory,
                       long persistenceTimeoutMs,
                       JacksonMapper mapper,
                       Metrics metrics,
                       Clock clock) {

        this.dealRecordBuilder = Objects.requireNonNull(dealRecordBuilder);
        this.evaluationStore = Objects.requireNonNull(evaluationStore);
        this.timeoutExecutor = Objects.requireNonNull(timeoutExecutor);
        this.timeoutFactory = Objects.requireNonNull(timeoutFactory);
        this.persistenceTimeoutMs = persistenceTimeoutMs;
        this.mapper = Objects.requireNonNull(mapper);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Creates a deal at the price and volume the buyer proposed. Fails unless the proposal was accepted.
     */
    public Future<DealCreationResult> createDeal(ProposalRequest request,
                                                 ProposalOutcome outcome,
                                                 ActivationType activationType) {

        if (outcome == null || outcome.getStatus() != ProposalStatus.ACCEPTED) {
            return Future.failedFuture(new SellerException(
                    "Proposal %s is not accepted".formatted(request.getProposalId())));
        }

        return register(dealRecordBuilder.build(request, request.getPrice(), request.getImpressions(),
                activationType));
    }

    /**
     * Creates a deal on the seller's counter terms once the buyer agreed to them.
     */
    public Future<DealCreationResult> createDealFromCounter(ProposalRequest request,
                                                            ProposalOutcome outcome,
                                                            ActivationType activationType) {

        final ProposalEvaluation evaluation = outcome != null ? outcome.getEvaluation() : null;
        final CounterTerms counterTerms = evaluation != null ? evaluation.getCounterTerms() : null;
        if (outcome == null || outcome.getStatus() != ProposalStatus.COUNTER_PENDING || counterTerms == null) {
            return Future.failedFuture(new SellerException(
                    "Proposal %s has no pending counter terms".formatted(request.getProposalId())));
        }

        return register(dealRecordBuilder.build(
                request,
                ObjectUtils.defaultIfNull(counterTerms.getProposedPrice(), request.getPrice()),
                ObjectUtils.defaultIfNull(counterTerms.getMaxImpressions(), request.getImpressions()),
                activationType));
    }

    private Future<DealCreationResult> register(DealCreationResult result) {
        final String dealId = result.getDeal().getDealId();
        final StoredRecord record = StoredRecord.of(RecordType.DEAL.key(dealId), RecordType.DEAL,
                mapper.encodeToFlatMap(result.getDeal()), clock.instant());

        metrics.updateDealCreatedMetric(result.getDeal().getDealType().toString());
        logger.info("Deal {0} created for proposal {1}", dealId, result.getDeal().getProposalId());

        return timeoutExecutor.execute(() -> evaluationStore.save(record), persistenceTimeoutMs,
                        timeoutFactory.create(persistenceTimeoutMs))
                .recover(throwable -> {
                    logger.warn("Failed to persist deal {0}: {1}", dealId, throwable.getMessage());
                    metrics.updateFallbackMetric(MetricName.persistence_failure);
                    return Future.succeededFuture();
                })
                .map(ignored -> result);
    }
}
