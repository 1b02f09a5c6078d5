package org.adseller.server.proposal;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.adseller.server.VertxTest;
import org.adseller.server.audience.AudienceValidator;
import org.adseller.server.audience.EmbeddingService;
import org.adseller.server.audience.SimilarityCalculator;
import org.adseller.server.audience.model.Consent;
import org.adseller.server.audience.model.Embedding;
import org.adseller.server.audience.model.ValidationStatus;
import org.adseller.server.availability.AvailabilitySource;
import org.adseller.server.availability.ConfiguredAvailabilitySource;
import org.adseller.server.buyer.BuyerTierResolver;
import org.adseller.server.catalog.InMemoryProductCatalog;
import org.adseller.server.catalog.model.ProductDefinition;
import org.adseller.server.exception.SellerException;
import org.adseller.server.execution.TimeoutExecutor;
import org.adseller.server.execution.TimeoutFactory;
import org.adseller.server.identity.IdGenerator;
import org.adseller.server.metric.MetricName;
import org.adseller.server.metric.Metrics;
import org.adseller.server.pricing.PricingRulesEngine;
import org.adseller.server.pricing.model.TieredPricingConfig;
import org.adseller.server.proposal.advisor.ProposalAdvisor;
import org.adseller.server.proposal.advisor.RuleBasedProposalAdvisor;
import org.adseller.server.proposal.model.EvaluationStage;
import org.adseller.server.proposal.model.ProposalEvaluation;
import org.adseller.server.proposal.model.ProposalOutcome;
import org.adseller.server.proposal.model.ProposalRequest;
import org.adseller.server.proposal.model.ProposalStatus;
import org.adseller.server.storage.EvaluationStore;
import org.adseller.server.storage.InMemoryEvaluationStore;
import org.adseller.server.storage.StoredRecord;
import org.adseller.server.yield.YieldOptimizer;
import org.adseller.server.yield.model.CounterTerms;
import org.adseller.server.yield.model.Recommendation;
import org.adseller.server.yield.model.UpsellSuggestion;
import org.adseller.server.yield.model.UpsellType;
import org.adseller.server.yield.model.YieldWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static java.util.function.UnaryOperator.identity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
public class ProposalEvaluationServiceTest extends VertxTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private Vertx vertx;

    @Mock
    private Metrics metrics;

    @Mock
    private IdGenerator idGenerator;

    @Mock
    private ProposalAdvisor remoteAdvisor;

    @Mock
    private EmbeddingService remoteEmbeddingService;

    @Mock
    private AvailabilitySource failingAvailabilitySource;

    @Mock
    private EvaluationStore failingEvaluationStore;

    private AvailabilitySource availabilitySource;

    private ProposalAdvisor proposalAdvisor;

    private EmbeddingService embeddingService;

    private EvaluationStore evaluationStore;

    private ProposalTracker proposalTracker;

    private ProposalEvaluationService target;

    @BeforeEach
    public void setUp() {
        availabilitySource = new ConfiguredAvailabilitySource(1_000_000L, Map.of());
        proposalAdvisor = null;
        embeddingService = null;
        evaluationStore = new InMemoryEvaluationStore();
        proposalTracker = new ProposalTracker();
        target = createService();
    }

    @Test
    public void evaluateShouldFailWhenRequiredFieldIsMissing() {
        // given
        final ProposalRequest request = givenRequest(builder -> builder.startDate(null));

        // when
        final ProposalOutcome result = target.evaluate(request).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.FAILED);
        assertThat(result.getStages())
                .containsExactly(EvaluationStage.RECEIVED, EvaluationStage.FAILED, EvaluationStage.FINALIZED);
        assertThat(result.getErrors()).containsExactly("Missing required fields: [start_date]");
        assertThat(result.getEvaluation()).isNull();
        assertThat(history("proposal:proposal-1")).isEmpty();
        assertThat(history("decision:proposal-1")).hasSize(1)
                .first()
                .satisfies(record -> assertThat(record.getPayload()).contains(entry("status", "failed")));
        verify(metrics).updateProposalReceivedMetric();
        verify(metrics).updateProposalStatusMetric(ProposalStatus.FAILED);
    }

    @Test
    public void evaluateShouldAcceptProposalAtAskingPrice() {
        // when
        final ProposalOutcome result = target.evaluate(givenRequest(identity())).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.ACCEPTED);
        assertThat(result.getDecidedBy()).isEqualTo(RuleBasedProposalAdvisor.NAME);
        assertThat(result.getStages()).containsExactly(
                EvaluationStage.RECEIVED,
                EvaluationStage.PRODUCT_VALIDATED,
                EvaluationStage.AUDIENCE_VALIDATED,
                EvaluationStage.PRICING_EVALUATED,
                EvaluationStage.AVAILABILITY_CHECKED,
                EvaluationStage.SCORED,
                EvaluationStage.DECIDED,
                EvaluationStage.UPSELL_IDENTIFIED,
                EvaluationStage.FINALIZED);
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getReceivedAt()).isEqualTo(CLOCK.instant());

        final ProposalEvaluation evaluation = result.getEvaluation();
        assertThat(evaluation.isValid()).isTrue();
        assertThat(evaluation.getRecommendation()).isEqualTo(Recommendation.ACCEPT);
        assertThat(evaluation.getRecommendedPrice()).isEqualByComparingTo("20.00");
        assertThat(evaluation.getMinimumAcceptablePrice()).isEqualByComparingTo("5");
        assertThat(evaluation.getAvailableImpressions()).isEqualTo(1_000_000L);
        assertThat(evaluation.getYieldScore()).isNotNull();
        assertThat(evaluation.getUpsellOpportunities()).extracting(UpsellSuggestion::getType)
                .containsExactly(UpsellType.VOLUME_UPGRADE, UpsellType.CROSS_SELL);

        assertThat(proposalTracker.getAcceptedProposals()).containsExactly("proposal-1");
        assertThat(history("proposal:proposal-1")).hasSize(1);
        assertThat(history("decision:proposal-1")).hasSize(1);
        verify(metrics).updateProposalStatusMetric(ProposalStatus.ACCEPTED);
    }

    @Test
    public void evaluateShouldTreatMissingBuyerContextAsAnonymousBuyer() {
        // when
        final ProposalOutcome result = target.evaluate(givenRequest(builder -> builder.buyerContext(null))).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.ACCEPTED);
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getEvaluation().getPricingDecision().getPricingKey()).isEqualTo("public");
    }

    @Test
    public void evaluateShouldCounterProposalBelowProductFloor() {
        // when
        final ProposalOutcome result = target.evaluate(
                givenRequest(builder -> builder.price(BigDecimal.valueOf(3)))).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.COUNTER_PENDING);
        assertThat(result.getStages()).endsWith(EvaluationStage.DECIDED, EvaluationStage.COUNTER_TERMS_GENERATED,
                EvaluationStage.FINALIZED);

        final ProposalEvaluation evaluation = result.getEvaluation();
        assertThat(evaluation.isPriceAcceptable()).isFalse();
        assertThat(evaluation.getPriceReason()).isEqualTo("Below product floor ($5.00 CPM)");

        final CounterTerms counterTerms = evaluation.getCounterTerms();
        assertThat(counterTerms.getProposedPrice()).isEqualByComparingTo("20.00");
        assertThat(counterTerms.getFloorPrice()).isEqualByComparingTo("5");
        assertThat(counterTerms.getMaxImpressions()).isEqualTo(500_000L);
        assertThat(counterTerms.getReason()).isEqualTo("Price below minimum acceptable threshold");
        assertThat(proposalTracker.getCounteredProposals()).containsExactly("proposal-1");
    }

    @Test
    public void evaluateShouldRejectUnknownProductWithoutConsultingAdvisor() {
        // given
        proposalAdvisor = remoteAdvisor;
        target = createService();

        // when
        final ProposalOutcome result = target.evaluate(
                givenRequest(builder -> builder.productId("unknown"))).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.REJECTED);
        assertThat(result.getDecidedBy()).isEqualTo(ProposalEvaluationService.VALIDATION_DECIDER);
        assertThat(result.getErrors()).containsExactly("Product not found: unknown");

        final ProposalEvaluation evaluation = result.getEvaluation();
        assertThat(evaluation.isValid()).isFalse();
        assertThat(evaluation.getPriceReason()).isEqualTo("Product not found");
        assertThat(evaluation.isImpressionsAvailable()).isFalse();
        assertThat(evaluation.getRejectionReason()).isEqualTo("Product not found: unknown");
        assertThat(evaluation.getUpsellOpportunities()).containsExactly(
                UpsellSuggestion.of(UpsellType.ALTERNATIVE_PRODUCT, "Consider our other inventory options"));
        assertThat(proposalTracker.getRejectedProposals()).containsExactly("proposal-1");
    }

    @Test
    public void evaluateShouldRecordInconsistentFieldsAsValidationErrors() {
        // when
        final ProposalOutcome result = target.evaluate(givenRequest(builder -> builder
                .startDate(LocalDate.parse("2026-03-01"))
                .endDate(LocalDate.parse("2026-02-01")))).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.REJECTED);
        assertThat(result.getEvaluation().getValidationErrors())
                .containsExactly("Flight end date 2026-02-01 is before start date 2026-03-01");
    }

    @Test
    public void evaluateShouldWarnAboutUnsupportedDealTypeAndSmallVolume() {
        // when
        final ProposalOutcome result = target.evaluate(givenRequest(builder -> builder
                .dealType("pg")
                .impressions(5_000L))).result();

        // then
        assertThat(result.getWarnings()).containsExactly(
                "Requested deal type pg not supported for product",
                "Requested 5,000 impressions below product minimum of 10,000");
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.ACCEPTED);
    }

    @Test
    public void evaluateShouldRejectWhenRequestedVolumeExceedsAvailability() {
        // given
        availabilitySource = new ConfiguredAvailabilitySource(100_000L, Map.of());
        target = createService();

        // when
        final ProposalOutcome result = target.evaluate(givenRequest(identity())).result();

        // then
        final ProposalEvaluation evaluation = result.getEvaluation();
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.REJECTED);
        assertThat(evaluation.isValid()).isTrue();
        assertThat(evaluation.isImpressionsAvailable()).isFalse();
        assertThat(evaluation.getValidationErrors())
                .containsExactly("Requested 500,000 impressions but only 100,000 available");
        assertThat(evaluation.getRejectionReason())
                .isEqualTo("Requested 500,000 impressions but only 100,000 available");
    }

    @Test
    public void evaluateShouldAssumeNoInventoryWhenAvailabilityCheckFails() {
        // given
        given(failingAvailabilitySource.availableImpressions(any(), any(), any()))
                .willReturn(Future.failedFuture(new SellerException("inventory system down")));
        availabilitySource = failingAvailabilitySource;
        target = createService();

        // when
        final ProposalOutcome result = target.evaluate(givenRequest(identity())).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.REJECTED);
        assertThat(result.getWarnings()).containsExactly("Availability check warning: inventory system down");
        assertThat(result.getEvaluation().getAvailableImpressions()).isZero();
        assertThat(result.getEvaluation().getValidationErrors()).isEmpty();
        assertThat(result.getEvaluation().getRejectionReason()).isEqualTo("Insufficient inventory availability");
        verify(metrics).updateFallbackMetric(MetricName.availability_fallback);
    }

    @Test
    public void evaluateShouldUseAdvisorRecommendation() {
        // given
        given(remoteAdvisor.advise(any(), any(), any())).willReturn(Future.succeededFuture(Recommendation.COUNTER));
        given(remoteAdvisor.name()).willReturn("advisory_agent");
        proposalAdvisor = remoteAdvisor;
        target = createService();

        // when
        final ProposalOutcome result = target.evaluate(givenRequest(identity())).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.COUNTER_PENDING);
        assertThat(result.getDecidedBy()).isEqualTo("advisory_agent");
        assertThat(result.getEvaluation().getCounterTerms().getReason()).isEqualTo("Standard counter terms");
    }

    @Test
    public void evaluateShouldFallBackToRuleBasedDecisionWhenAdvisorFails() {
        // given
        given(remoteAdvisor.advise(any(), any(), any()))
                .willReturn(Future.failedFuture(new SellerException("agent unavailable")));
        given(remoteAdvisor.name()).willReturn("advisory_agent");
        proposalAdvisor = remoteAdvisor;
        target = createService();

        // when
        final ProposalOutcome result = target.evaluate(givenRequest(identity())).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.ACCEPTED);
        assertThat(result.getDecidedBy()).isEqualTo(RuleBasedProposalAdvisor.NAME);
        assertThat(result.getWarnings()).containsExactly("Advisory evaluation failed: agent unavailable");
        verify(metrics).updateFallbackMetric(MetricName.advisor_fallback);
    }

    @Test
    public void evaluateShouldTreatAudienceAsCompatibleWhenEmbeddingsAreUnavailable() {
        // when
        final ProposalOutcome result = target.evaluate(givenRequest(builder -> builder
                .audienceTargeting(Map.of("interests", List.of("sports"))))).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.ACCEPTED);
        assertThat(result.getWarnings())
                .containsExactly("Audience validation warning: Buyer embedding is not available");
        assertThat(result.getEvaluation().isAudienceValidated()).isFalse();
        assertThat(result.getEvaluation().isTargetingCompatible()).isTrue();
        assertThat(result.getEvaluation().getAudienceGaps()).containsExactly("validation_error");
        verify(metrics).updateFallbackMetric(MetricName.audience_validation_fallback);
    }

    @Test
    public void evaluateShouldCounterWhenBuyerEmbeddingHasNoConsent() {
        // given
        given(remoteEmbeddingService.inventoryEmbedding(any(), any()))
                .willReturn(Future.succeededFuture(givenEmbedding(null)));
        embeddingService = remoteEmbeddingService;
        target = createService();

        final ProposalRequest request = givenRequest(builder -> builder
                .audienceTargeting(Map.of("interests", List.of("sports")))
                .buyerEmbedding(givenEmbedding(null)));

        // when
        final ProposalOutcome result = target.evaluate(request).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.COUNTER_PENDING);
        assertThat(result.getAudienceValidation().getValidationStatus()).isEqualTo(ValidationStatus.INVALID);
        assertThat(result.getWarnings()).containsExactly("Audience validation failed: Missing or invalid consent");
        assertThat(result.getEvaluation().isTargetingCompatible()).isFalse();
    }

    @Test
    public void evaluateShouldRequestEmbeddingsFromEmbeddingService() {
        // given
        final Embedding embedding = givenEmbedding(
                Consent.builder().permissibleUses(List.of("personalization")).build());
        given(remoteEmbeddingService.queryEmbedding(any(), any())).willReturn(Future.succeededFuture(embedding));
        given(remoteEmbeddingService.inventoryEmbedding(any(), any())).willReturn(Future.succeededFuture(embedding));
        embeddingService = remoteEmbeddingService;
        target = createService();

        // when
        final ProposalOutcome result = target.evaluate(givenRequest(builder -> builder
                .audienceTargeting(Map.of("interests", List.of("sports"))))).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.ACCEPTED);
        assertThat(result.getAudienceValidation().getValidationStatus()).isEqualTo(ValidationStatus.VALID);
        assertThat(result.getEvaluation().isAudienceValidated()).isTrue();
        assertThat(result.getEvaluation().getUcpSimilarityScore()).isEqualTo(1.0);
    }

    @Test
    public void evaluateShouldKeepOutcomeWhenPersistenceFails() {
        // given
        given(failingEvaluationStore.save(any())).willReturn(Future.failedFuture(new SellerException("disk full")));
        evaluationStore = failingEvaluationStore;
        target = createService();

        // when
        final ProposalOutcome result = target.evaluate(givenRequest(identity())).result();

        // then
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.ACCEPTED);
        assertThat(result.getWarnings()).containsExactly("Persistence warning: disk full");
        verify(metrics).updateFallbackMetric(MetricName.persistence_failure);
    }

    @Test
    public void evaluateShouldGenerateProposalIdWhenAbsent() {
        // given
        given(idGenerator.generateId()).willReturn("generated-id");

        // when
        final ProposalOutcome result = target.evaluate(givenRequest(builder -> builder.proposalId(" "))).result();

        // then
        assertThat(result.getProposalId()).isEqualTo("generated-id");
        assertThat(history("decision:generated-id")).hasSize(1);
    }

    private ProposalEvaluationService createService() {
        final BuyerTierResolver tierResolver = new BuyerTierResolver();

        return new ProposalEvaluationService(
                new InMemoryProductCatalog(List.of(givenProduct("display-premium", "display"),
                        givenProduct("video-instream", "video"))),
                new ProposalRequestValidator(),
                new AudienceValidator(new SimilarityCalculator(),
                        AudienceValidator.DEFAULT_MINIMUM_COVERAGE_THRESHOLD, CLOCK),
                embeddingService,
                new PricingRulesEngine(TieredPricingConfig.builder().sellerOrganizationId("seller-1").build(),
                        tierResolver, CLOCK),
                availabilitySource,
                new YieldOptimizer(YieldWeights.defaultWeights(), YieldOptimizer.DEFAULT_FILL_RATE_TARGET,
                        tierResolver),
                proposalAdvisor,
                new RuleBasedProposalAdvisor(),
                evaluationStore,
                proposalTracker,
                new ProposalSerializer(),
                new TimeoutExecutor(vertx),
                new TimeoutFactory(CLOCK),
                idGenerator,
                ProposalEvaluationSettings.builder().build(),
                jacksonMapper,
                metrics,
                CLOCK);
    }

    private List<StoredRecord> history(String key) {
        return evaluationStore.history(key).result();
    }

    private static ProductDefinition givenProduct(String productId, String inventoryType) {
        return ProductDefinition.builder()
                .productId(productId)
                .name(productId)
                .inventoryType(inventoryType)
                .baseCpm(BigDecimal.valueOf(20))
                .floorCpm(BigDecimal.valueOf(5))
                .build();
    }

    private static Embedding givenEmbedding(Consent consent) {
        return Embedding.builder()
                .vector(List.of(1.0, 0.0))
                .dimension(2)
                .consent(consent)
                .build();
    }

    private static ProposalRequest givenRequest(UnaryOperator<ProposalRequest.ProposalRequestBuilder> customizer) {
        return customizer.apply(ProposalRequest.builder()
                        .proposalId("proposal-1")
                        .productId("display-premium")
                        .dealType("preferred_deal")
                        .price(BigDecimal.valueOf(20))
                        .impressions(500_000L)
                        .startDate(LocalDate.parse("2026-02-01"))
                        .endDate(LocalDate.parse("2026-02-28")))
                .build();
    }
}
