package org.adseller.server.proposal;

import io.vertx.core.Future;
import org.adseller.server.audience.AudienceValidator;
import org.adseller.server.audience.DefaultAudienceCapabilities;
import org.adseller.server.audience.EmbeddingService;
import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.AudienceValidationResult;
import org.adseller.server.audience.model.Embedding;
import org.adseller.server.audience.model.ValidationStatus;
import org.adseller.server.availability.AvailabilitySource;
import org.adseller.server.availability.FlightDates;
import org.adseller.server.buyer.BuyerContext;
import org.adseller.server.catalog.ProductCatalog;
import org.adseller.server.catalog.model.ProductDefinition;
import org.adseller.server.deal.model.DealType;
import org.adseller.server.exception.SellerException;
import org.adseller.server.execution.TimeoutExecutor;
import org.adseller.server.execution.TimeoutFactory;
import org.adseller.server.identity.IdGenerator;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.log.Logger;
import org.adseller.server.log.LoggerFactory;
import org.adseller.server.metric.MetricName;
import org.adseller.server.metric.Metrics;
import org.adseller.server.pricing.PricingRulesEngine;
import org.adseller.server.pricing.model.PriceAcceptance;
import org.adseller.server.pricing.model.PricingDecision;
import org.adseller.server.proposal.advisor.ProposalAdvisor;
import org.adseller.server.proposal.advisor.RuleBasedProposalAdvisor;
import org.adseller.server.proposal.model.EvaluationContext;
import org.adseller.server.proposal.model.EvaluationStage;
import org.adseller.server.proposal.model.ProposalDecision;
import org.adseller.server.proposal.model.ProposalEvaluation;
import org.adseller.server.proposal.model.ProposalOutcome;
import org.adseller.server.proposal.model.ProposalRequest;
import org.adseller.server.proposal.model.ProposalStatus;
import org.adseller.server.storage.EvaluationStore;
import org.adseller.server.storage.RecordType;
import org.adseller.server.storage.StoredRecord;
import org.adseller.server.yield.YieldOptimizer;
import org.adseller.server.yield.model.CounterTerms;
import org.adseller.server.yield.model.Recommendation;
import org.adseller.server.yield.model.UpsellSuggestion;
import org.adseller.server.yield.model.UpsellType;
import org.adseller.server.yield.model.YieldRecommendation;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a proposal through product, audience, pricing and availability checks, scores it and decides whether it
 * is accepted, countered or rejected.
 * <p>
 * Only missing required fields stop the pipeline. Every collaborator call is bounded by the evaluation time
 * budget and falls back to a conservative default on failure, so each run ends with a terminal status.
 */
public class ProposalEvaluationService {

    private static final Logger logger = LoggerFactory.getLogger(ProposalEvaluationService.class);

    static final String VALIDATION_DECIDER = "validation";

    private static final String PRICE_BELOW_MINIMUM = "Price below minimum acceptable threshold";
    private static final String ALTERNATIVE_PRODUCT_MESSAGE = "Consider our other inventory options";

    private final ProductCatalog productCatalog;
    private final ProposalRequestValidator requestValidator;
    private final AudienceValidator audienceValidator;
    private final EmbeddingService embeddingService;
    private final PricingRulesEngine pricingRulesEngine;
    private final AvailabilitySource availabilitySource;
    private final YieldOptimizer yieldOptimizer;
    private final ProposalAdvisor proposalAdvisor;
    private final RuleBasedProposalAdvisor fallbackAdvisor;
    private final EvaluationStore evaluationStore;
    private final ProposalTracker proposalTracker;
    private final ProposalSerializer proposalSerializer;
    private final TimeoutExecutor timeoutExecutor;
    private final TimeoutFactory timeoutFactory;
    private final IdGenerator idGenerator;
    private final ProposalEvaluationSettings settings;
    private final JacksonMapper mapper;
    private final Metrics metrics;
    private final Clock clock;

    public ProposalEvaluationService(ProductCatalog productCatalog,
                                     ProposalRequestValidator requestValidator,
                                     AudienceValidator audienceValidator,
                                     EmbeddingService embeddingService,
                                     PricingRulesEngine pricingRulesEngine,
                                     AvailabilitySource availabilitySource,
                                     YieldOptimizer yieldOptimizer,
                                     ProposalAdvisor proposalAdvisor,
                                     RuleBasedProposalAdvisor fallbackAdvisor,
                                     EvaluationStore evaluationStore,
                                     ProposalTracker proposalTracker,
                                     ProposalSerializer proposalSerializer,
                                     TimeoutExecutor timeoutExecutor,
                                     TimeoutFactory timeoutFactory,
                                     IdGenerator idGenerator,
                                     ProposalEvaluationSettings settings,
                                     JacksonMapper mapper,
                                     Metrics metrics,
                                     Clock clock) {

        this.productCatalog = Objects.requireNonNull(productCatalog);
        this.requestValidator = Objects.requireNonNull(requestValidator);
        this.audienceValidator = Objects.requireNonNull(audienceValidator);
        this.embeddingService = embeddingService;
        this.pricingRulesEngine = Objects.requireNonNull(pricingRulesEngine);
        this.availabilitySource = Objects.requireNonNull(availabilitySource);
        this.yieldOptimizer = Objects.requireNonNull(yieldOptimizer);
        this.fallbackAdvisor = Objects.requireNonNull(fallbackAdvisor);
        this.proposalAdvisor = ObjectUtils.defaultIfNull(proposalAdvisor, fallbackAdvisor);
        this.evaluationStore = Objects.requireNonNull(evaluationStore);
        this.proposalTracker = Objects.requireNonNull(proposalTracker);
        this.proposalSerializer = Objects.requireNonNull(proposalSerializer);
        this.timeoutExecutor = Objects.requireNonNull(timeoutExecutor);
        this.timeoutFactory = Objects.requireNonNull(timeoutFactory);
        this.idGenerator = Objects.requireNonNull(idGenerator);
        this.settings = Objects.requireNonNull(settings);
        this.mapper = Objects.requireNonNull(mapper);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Evaluates the proposal. The returned future always succeeds, failures are reported through the outcome
     * status and errors. Evaluations of the same proposal id run one after another.
     */
    public Future<ProposalOutcome> evaluate(ProposalRequest request) {
        final long startTime = clock.millis();
        metrics.updateProposalReceivedMetric();

        final ProposalRequest identifiedRequest = StringUtils.isBlank(request.getProposalId())
                ? request.toBuilder().proposalId(idGenerator.generateId()).build()
                : request;

        return proposalSerializer.serialize(identifiedRequest.getProposalId(), () -> runPipeline(identifiedRequest))
                .onSuccess(outcome -> {
                    metrics.updateProposalStatusMetric(outcome.getStatus());
                    metrics.updateEvaluationTimeMetric(clock.millis() - startTime);
                });
    }

    private Future<ProposalOutcome> runPipeline(ProposalRequest request) {
        final EvaluationContext initialContext = EvaluationContext.builder()
                .request(request)
                .timeout(timeoutFactory.create(settings.getEvaluationTimeoutMs()))
                .receivedAt(clock.instant())
                .status(ProposalStatus.RECEIVED)
                .stages(new ArrayList<>())
                .errors(new ArrayList<>())
                .warnings(new ArrayList<>())
                .build();
        enterStage(initialContext, EvaluationStage.RECEIVED);

        final List<String> missingFields = requestValidator.missingRequiredFields(request);
        if (!missingFields.isEmpty()) {
            initialContext.getErrors().addAll(missingFields);
            return finalizeEvaluation(markFailed(initialContext));
        }

        return Future.succeededFuture(validateProduct(initialContext.toBuilder()
                        .status(ProposalStatus.EVALUATING)
                        .build()))
                .compose(this::validateAudience)
                .map(this::evaluatePricing)
                .compose(this::checkAvailability)
                .map(this::score)
                .compose(this::decide)
                .map(this::generateFollowUp)
                .compose(this::finalizeEvaluation)
                .recover(throwable -> unexpectedFailure(initialContext, throwable));
    }

    private EvaluationContext validateProduct(EvaluationContext context) {
        enterStage(context, EvaluationStage.PRODUCT_VALIDATED);

        final ProposalRequest request = context.getRequest();
        final ProductDefinition product = productCatalog.getProduct(request.getProductId()).orElse(null);
        final List<String> validationErrors = new ArrayList<>(requestValidator.inconsistentFields(request));

        if (product == null) {
            final String error = "Product not found: " + request.getProductId();
            validationErrors.add(error);
            context.getErrors().add(error);
        } else {
            validateProductTerms(context, request, product);
        }

        final ProposalEvaluation evaluation = ProposalEvaluation.builder()
                .proposalId(request.getProposalId())
                .proposalLineId(request.getLineId())
                .productId(request.getProductId())
                .evaluatedAt(clock.instant())
                .valid(validationErrors.isEmpty())
                .validationErrors(List.copyOf(validationErrors))
                .requestedPrice(ObjectUtils.defaultIfNull(request.getPrice(), BigDecimal.ZERO))
                .requestedImpressions(request.getImpressions())
                .minimumAcceptablePrice(product != null ? product.getFloorCpm() : null)
                .build();

        return context.with(product).with(evaluation);
    }

    private static void validateProductTerms(EvaluationContext context,
                                             ProposalRequest request,
                                             ProductDefinition product) {

        final String requestedDealType = request.getDealType();
        if (StringUtils.isNotBlank(requestedDealType)) {
            final DealType dealType = DealType.fromString(requestedDealType);
            if (dealType == null || !product.supportsDealType(dealType)) {
                context.getWarnings().add(
                        "Requested deal type %s not supported for product".formatted(requestedDealType));
            }
        }

        final long impressions = request.getImpressions();
        if (impressions < product.getMinimumImpressions()) {
            context.getWarnings().add(String.format(Locale.ROOT,
                    "Requested %,d impressions below product minimum of %,d",
                    impressions, product.getMinimumImpressions()));
        }
        if (product.getMaximumImpressions() != null && impressions > product.getMaximumImpressions()) {
            context.getWarnings().add(String.format(Locale.ROOT,
                    "Requested %,d impressions above product maximum of %,d",
                    impressions, product.getMaximumImpressions()));
        }
    }

    private Future<EvaluationContext> validateAudience(EvaluationContext context) {
        enterStage(context, EvaluationStage.AUDIENCE_VALIDATED);

        final ProductDefinition product = context.getProduct();
        final Map<String, Object> targeting = context.getRequest().getAudienceTargeting();
        if (product == null || MapUtils.isEmpty(targeting)) {
            return Future.succeededFuture(context);
        }

        return buyerEmbedding(context)
                .compose(buyerEmbedding -> productEmbedding(context)
                        .map(productEmbedding -> audienceValidator.validate(
                                buyerEmbedding, productEmbedding, capabilities(product), targeting)))
                .map(result -> applyAudienceValidation(context, result))
                .recover(throwable -> Future.succeededFuture(audienceValidationFallback(context, throwable)));
    }

    private Future<Embedding> buyerEmbedding(EvaluationContext context) {
        final ProposalRequest request = context.getRequest();
        if (request.getBuyerEmbedding() != null) {
            return Future.succeededFuture(request.getBuyerEmbedding());
        }
        if (embeddingService == null) {
            return Future.failedFuture(new SellerException("Buyer embedding is not available"));
        }

        return timeoutExecutor.execute(
                () -> embeddingService.queryEmbedding(request.getAudienceTargeting(), context.getTimeout()),
                settings.getEmbeddingTimeoutMs(),
                context.getTimeout());
    }

    private Future<Embedding> productEmbedding(EvaluationContext context) {
        final ProductDefinition product = context.getProduct();
        if (product.getProductEmbedding() != null) {
            return Future.succeededFuture(product.getProductEmbedding());
        }
        if (embeddingService == null) {
            return Future.failedFuture(new SellerException(
                    "Product embedding is not available for " + product.getProductId()));
        }

        return timeoutExecutor.execute(
                () -> embeddingService.inventoryEmbedding(product, context.getTimeout()),
                settings.getEmbeddingTimeoutMs(),
                context.getTimeout());
    }

    private static List<AudienceCapability> capabilities(ProductDefinition product) {
        return CollectionUtils.isNotEmpty(product.getAudienceCapabilities())
                ? product.getAudienceCapabilities()
                : DefaultAudienceCapabilities.forProduct(product.getProductId());
    }

    private EvaluationContext applyAudienceValidation(EvaluationContext context, AudienceValidationResult result) {
        if (result.getValidationStatus() == ValidationStatus.INVALID) {
            context.getWarnings().add("Audience validation failed: " + String.join(", ", result.getValidationNotes()));
        } else if (!result.isTargetingCompatible()) {
            context.getWarnings().add(String.format(Locale.ROOT, "Audience coverage below threshold: %.1f%%",
                    result.getOverallCoveragePercentage()));
        }

        final ProposalEvaluation evaluation = context.getEvaluation().toBuilder()
                .audienceValidated(result.getValidationStatus() != ValidationStatus.INVALID)
                .audienceCoverage(result.getOverallCoveragePercentage())
                .audienceGaps(result.getGaps())
                .ucpSimilarityScore(result.getUcpSimilarityScore())
                .targetingCompatible(result.isTargetingCompatible())
                .targetingNotes(result.getValidationNotes())
                .build();

        return context.with(evaluation).with(result);
    }

    private EvaluationContext audienceValidationFallback(EvaluationContext context, Throwable throwable) {
        logger.warn("Audience validation failed for proposal {0}: {1}",
                context.getRequest().getProposalId(), throwable.getMessage());
        metrics.updateFallbackMetric(MetricName.audience_validation_fallback);
        context.getWarnings().add("Audience validation warning: " + throwable.getMessage());

        final ProposalEvaluation evaluation = context.getEvaluation().toBuilder()
                .audienceValidated(false)
                .audienceGaps(Collections.singletonList("validation_error"))
                .targetingCompatible(true)
                .build();

        return context.with(evaluation);
    }

    private EvaluationContext evaluatePricing(EvaluationContext context) {
        enterStage(context, EvaluationStage.PRICING_EVALUATED);

        final ProductDefinition product = context.getProduct();
        if (product == null) {
            return context.with(context.getEvaluation().toBuilder()
                    .priceAcceptable(false)
                    .priceReason("Product not found")
                    .build());
        }

        final ProposalRequest request = context.getRequest();
        final BuyerContext buyerContext = request.getBuyerContext();
        final DealType dealType = ObjectUtils.defaultIfNull(DealType.fromString(request.getDealType()),
                DealType.PREFERRED_DEAL);

        final PricingDecision pricingDecision = pricingRulesEngine.calculatePrice(
                product.getProductId(),
                product.getBaseCpm(),
                buyerContext,
                dealType,
                request.getImpressions(),
                product.getInventoryType());
        final PriceAcceptance acceptance = pricingRulesEngine.isPriceAcceptable(
                request.getPrice(), product.getFloorCpm(), buyerContext);

        return context.with(context.getEvaluation().toBuilder()
                .minimumAcceptablePrice(product.getFloorCpm())
                .recommendedPrice(pricingDecision.getFinalPrice())
                .priceAcceptable(acceptance.isAcceptable())
                .priceReason(acceptance.getReason())
                .pricingDecision(pricingDecision)
                .build());
    }

    private Future<EvaluationContext> checkAvailability(EvaluationContext context) {
        enterStage(context, EvaluationStage.AVAILABILITY_CHECKED);

        final ProductDefinition product = context.getProduct();
        if (product == null) {
            return Future.succeededFuture(context.with(context.getEvaluation().toBuilder()
                    .availableImpressions(0L)
                    .impressionsAvailable(false)
                    .build()));
        }

        final ProposalRequest request = context.getRequest();
        final FlightDates flight = FlightDates.of(request.getStartDate(), request.getEndDate());

        return timeoutExecutor.execute(
                        () -> availabilitySource.availableImpressions(product.getProductId(), flight,
                                context.getTimeout()),
                        settings.getAvailabilityTimeoutMs(),
                        context.getTimeout())
                .map(available -> applyAvailability(context, ObjectUtils.defaultIfNull(available, 0L)))
                .recover(throwable -> Future.succeededFuture(availabilityFallback(context, throwable)));
    }

    private static EvaluationContext applyAvailability(EvaluationContext context, long available) {
        final ProposalEvaluation evaluation = context.getEvaluation();
        final long requested = evaluation.getRequestedImpressions();
        final boolean impressionsAvailable = requested <= available;

        final ProposalEvaluation.ProposalEvaluationBuilder builder = evaluation.toBuilder()
                .availableImpressions(available)
                .impressionsAvailable(impressionsAvailable);

        if (!impressionsAvailable) {
            final List<String> validationErrors = new ArrayList<>(evaluation.getValidationErrors());
            validationErrors.add(String.format(Locale.ROOT, "Requested %,d impressions but only %,d available",
                    requested, available));
            builder.validationErrors(List.copyOf(validationErrors));
        }

        return context.with(builder.build());
    }

    private EvaluationContext availabilityFallback(EvaluationContext context, Throwable throwable) {
        logger.warn("Availability check failed for proposal {0}: {1}",
                context.getRequest().getProposalId(), throwable.getMessage());
        metrics.updateFallbackMetric(MetricName.availability_fallback);
        context.getWarnings().add("Availability check warning: " + throwable.getMessage());

        return context.with(context.getEvaluation().toBuilder()
                .availableImpressions(0L)
                .impressionsAvailable(false)
                .build());
    }

    private EvaluationContext score(EvaluationContext context) {
        enterStage(context, EvaluationStage.SCORED);

        final ProductDefinition product = context.getProduct();
        final BigDecimal marketCpm = settings.marketCpm(product != null ? product.getInventoryType() : null);

        return context.with(context.getEvaluation().toBuilder()
                .yieldScore(yieldOptimizer.scoreDeal(context.getEvaluation(),
                        context.getRequest().getBuyerContext(), settings.getCurrentFillRate(), marketCpm))
                .build());
    }

    private Future<EvaluationContext> decide(EvaluationContext context) {
        final ProposalEvaluation evaluation = context.getEvaluation();

        if (!evaluation.isValid()) {
            return Future.succeededFuture(applyDecision(context, Recommendation.REJECT, VALIDATION_DECIDER));
        }
        if (proposalAdvisor == fallbackAdvisor) {
            return Future.succeededFuture(
                    applyDecision(context, fallbackAdvisor.decide(evaluation), fallbackAdvisor.name()));
        }

        return timeoutExecutor.execute(
                        () -> proposalAdvisor.advise(context.getRequest(), evaluation, context.getTimeout()),
                        settings.getAdvisorTimeoutMs(),
                        context.getTimeout())
                .map(recommendation -> applyDecision(context, recommendation, proposalAdvisor.name()))
                .recover(throwable -> Future.succeededFuture(advisorFallback(context, throwable)));
    }

    private EvaluationContext advisorFallback(EvaluationContext context, Throwable throwable) {
        logger.warn("Advisor {0} failed for proposal {1}: {2}", proposalAdvisor.name(),
                context.getRequest().getProposalId(), throwable.getMessage());
        metrics.updateFallbackMetric(MetricName.advisor_fallback);
        context.getWarnings().add("Advisory evaluation failed: " + throwable.getMessage());

        return applyDecision(context, fallbackAdvisor.decide(context.getEvaluation()), fallbackAdvisor.name());
    }

    private EvaluationContext applyDecision(EvaluationContext context, Recommendation advised, String decidedBy) {
        enterStage(context, EvaluationStage.DECIDED);

        final Recommendation recommendation = ObjectUtils.defaultIfNull(advised, Recommendation.REJECT);

        final String proposalId = context.getRequest().getProposalId();
        final ProposalEvaluation.ProposalEvaluationBuilder evaluation = context.getEvaluation().toBuilder()
                .recommendation(recommendation);
        final ProposalStatus status;

        switch (recommendation) {
            case ACCEPT -> {
                proposalTracker.accepted(proposalId);
                status = ProposalStatus.ACCEPTED;
            }
            case COUNTER -> {
                proposalTracker.countered(proposalId);
                evaluation.counterTerms(counterTerms(context));
                status = ProposalStatus.COUNTER_PENDING;
            }
            default -> {
                proposalTracker.rejected(proposalId);
                evaluation.rejectionReason(rejectionReason(context.getEvaluation()));
                status = ProposalStatus.REJECTED;
            }
        }

        logger.debug("Proposal {0} decided as {1} by {2}", proposalId, recommendation, decidedBy);

        return context.toBuilder()
                .evaluation(evaluation.build())
                .status(status)
                .decidedBy(decidedBy)
                .build();
    }

    private CounterTerms counterTerms(EvaluationContext context) {
        final ProposalEvaluation evaluation = context.getEvaluation();
        final YieldRecommendation yieldRecommendation = yieldOptimizer.recommendCounterTerms(
                evaluation, context.getRequest().getBuyerContext());
        final CounterTerms suggested = yieldRecommendation.getCounterTerms();

        return suggested.toBuilder()
                .proposedPrice(evaluation.getRecommendedPrice())
                .floorPrice(evaluation.getMinimumAcceptablePrice())
                .maxImpressions(Math.min(evaluation.getRequestedImpressions(), evaluation.getAvailableImpressions()))
                .reason(evaluation.isPriceAcceptable() ? suggested.getReason() : PRICE_BELOW_MINIMUM)
                .build();
    }

    private static String rejectionReason(ProposalEvaluation evaluation) {
        if (CollectionUtils.isNotEmpty(evaluation.getValidationErrors())) {
            return String.join("; ", evaluation.getValidationErrors());
        }
        if (!evaluation.isPriceAcceptable()) {
            return evaluation.getPriceReason();
        }
        return evaluation.getYieldScore() != null ? evaluation.getYieldScore().getRationale() : null;
    }

    private EvaluationContext generateFollowUp(EvaluationContext context) {
        final ProposalEvaluation evaluation = context.getEvaluation();
        if (evaluation.getRecommendation() == Recommendation.COUNTER) {
            enterStage(context, EvaluationStage.COUNTER_TERMS_GENERATED);
            return context;
        }

        enterStage(context, EvaluationStage.UPSELL_IDENTIFIED);
        final List<UpsellSuggestion> suggestions;
        if (evaluation.getRecommendation() == Recommendation.REJECT) {
            suggestions = Collections.singletonList(
                    UpsellSuggestion.of(UpsellType.ALTERNATIVE_PRODUCT, ALTERNATIVE_PRODUCT_MESSAGE));
        } else {
            final List<String> inventoryTypes = productCatalog.getProducts().stream()
                    .map(ProductDefinition::getInventoryType)
                    .filter(StringUtils::isNotBlank)
                    .distinct()
                    .toList();
            suggestions = ObjectUtils.defaultIfNull(yieldOptimizer.identifyUpsell(
                    evaluation,
                    context.getRequest().getBuyerContext(),
                    context.getProduct().getInventoryType(),
                    inventoryTypes).getUpsellOpportunities(), Collections.emptyList());
        }

        return context.with(evaluation.toBuilder().upsellOpportunities(suggestions).build());
    }

    private Future<ProposalOutcome> finalizeEvaluation(EvaluationContext context) {
        enterStage(context, EvaluationStage.FINALIZED);
        final Instant completedAt = clock.instant();

        return persist(context, completedAt)
                .map(ignored -> toOutcome(context, completedAt))
                .onSuccess(outcome -> logger.info("Proposal {0} finalized with status {1}",
                        outcome.getProposalId(), outcome.getStatus()));
    }

    private Future<Void> persist(EvaluationContext context, Instant completedAt) {
        final String proposalId = context.getRequest().getProposalId();
        final ProposalEvaluation evaluation = context.getEvaluation();

        final List<StoredRecord> records = new ArrayList<>();
        try {
            if (evaluation != null) {
                records.add(StoredRecord.of(RecordType.EVALUATION.key(proposalId), RecordType.EVALUATION,
                        mapper.encodeToFlatMap(evaluation), completedAt));
            }
            records.add(StoredRecord.of(RecordType.DECISION.key(proposalId), RecordType.DECISION,
                    mapper.encodeToFlatMap(toDecision(context, completedAt)), completedAt));
        } catch (RuntimeException e) {
            return Future.succeededFuture(persistenceFailure(context, e));
        }

        return timeoutExecutor.execute(() -> saveAll(records), settings.getPersistenceTimeoutMs(),
                        context.getTimeout())
                .recover(throwable -> Future.succeededFuture(persistenceFailure(context, throwable)));
    }

    private Future<Void> saveAll(List<StoredRecord> records) {
        Future<Void> result = Future.succeededFuture();
        for (StoredRecord record : records) {
            result = result.compose(ignored -> evaluationStore.save(record));
        }
        return result;
    }

    private Void persistenceFailure(EvaluationContext context, Throwable throwable) {
        logger.warn("Failed to persist evaluation of proposal {0}: {1}",
                context.getRequest().getProposalId(), throwable.getMessage());
        metrics.updateFallbackMetric(MetricName.persistence_failure);
        context.getWarnings().add("Persistence warning: " + throwable.getMessage());
        return null;
    }

    private static ProposalDecision toDecision(EvaluationContext context, Instant decidedAt) {
        final ProposalEvaluation evaluation = context.getEvaluation();

        return ProposalDecision.builder()
                .proposalId(context.getRequest().getProposalId())
                .status(context.getStatus())
                .recommendation(evaluation != null ? evaluation.getRecommendation() : null)
                .decidedBy(context.getDecidedBy())
                .counterTerms(evaluation != null ? evaluation.getCounterTerms() : null)
                .rejectionReason(evaluation != null ? evaluation.getRejectionReason() : null)
                .errors(List.copyOf(context.getErrors()))
                .warnings(List.copyOf(context.getWarnings()))
                .decidedAt(decidedAt)
                .build();
    }

    private Future<ProposalOutcome> unexpectedFailure(EvaluationContext context, Throwable throwable) {
        logger.error("Unexpected failure while evaluating proposal " + context.getRequest().getProposalId(),
                throwable);
        context.getErrors().add("Unexpected evaluation error: " + throwable.getMessage());

        final EvaluationContext failedContext = markFailed(context);
        enterStage(failedContext, EvaluationStage.FINALIZED);
        return Future.succeededFuture(toOutcome(failedContext, clock.instant()));
    }

    private static EvaluationContext markFailed(EvaluationContext context) {
        enterStage(context, EvaluationStage.FAILED);
        return context.toBuilder().status(ProposalStatus.FAILED).build();
    }

    private static ProposalOutcome toOutcome(EvaluationContext context, Instant completedAt) {
        return ProposalOutcome.builder()
                .proposalId(context.getRequest().getProposalId())
                .status(context.getStatus())
                .stages(List.copyOf(context.getStages()))
                .evaluation(context.getEvaluation())
                .audienceValidation(context.getAudienceValidation())
                .errors(List.copyOf(context.getErrors()))
                .warnings(List.copyOf(context.getWarnings()))
                .decidedBy(context.getDecidedBy())
                .receivedAt(context.getReceivedAt())
                .completedAt(completedAt)
                .build();
    }

    private static void enterStage(EvaluationContext context, EvaluationStage stage) {
        context.getStages().add(stage);
        if (logger.isDebugEnabled()) {
            logger.debug("Proposal {0} entered stage {1}", context.getRequest().getProposalId(), stage);
        }
    }
}
