package org.adseller.server.spring.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.adseller.server.audience.AudienceValidator;
import org.adseller.server.audience.EmbeddingService;
import org.adseller.server.availability.AvailabilitySource;
import org.adseller.server.buyer.BuyerTierResolver;
import org.adseller.server.catalog.ProductCatalog;
import org.adseller.server.deal.DealRecordBuilder;
import org.adseller.server.deal.DealService;
import org.adseller.server.execution.TimeoutExecutor;
import org.adseller.server.execution.TimeoutFactory;
import org.adseller.server.identity.IdGenerator;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.metric.Metrics;
import org.adseller.server.pricing.PricingRulesEngine;
import org.adseller.server.pricing.model.TieredPricingConfig;
import org.adseller.server.proposal.ProposalEvaluationService;
import org.adseller.server.proposal.ProposalEvaluationSettings;
import org.adseller.server.proposal.ProposalRequestValidator;
import org.adseller.server.proposal.ProposalSerializer;
import org.adseller.server.proposal.ProposalTracker;
import org.adseller.server.proposal.advisor.HttpProposalAdvisor;
import org.adseller.server.proposal.advisor.ProposalAdvisor;
import org.adseller.server.proposal.advisor.RuleBasedProposalAdvisor;
import org.adseller.server.storage.EvaluationStore;
import org.adseller.server.storage.InMemoryEvaluationStore;
import org.adseller.server.vertx.httpclient.HttpClient;
import org.adseller.server.yield.YieldOptimizer;
import org.adseller.server.yield.model.YieldWeights;
import org.apache.commons.collections4.MapUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Configuration
public class ProposalConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "yield")
    YieldProperties yieldProperties() {
        return new YieldProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "proposal")
    ProposalProperties proposalProperties() {
        return new ProposalProperties();
    }

    @Bean
    YieldOptimizer yieldOptimizer(YieldProperties yieldProperties, BuyerTierResolver buyerTierResolver) {
        return new YieldOptimizer(yieldProperties.toYieldWeights(), yieldProperties.getFillRateTarget(),
                buyerTierResolver);
    }

    @Bean
    RuleBasedProposalAdvisor ruleBasedProposalAdvisor() {
        return new RuleBasedProposalAdvisor();
    }

    @Bean
    @ConditionalOnProperty(prefix = "advisor.http", name = "enabled", havingValue = "true")
    HttpProposalAdvisor httpProposalAdvisor(@Value("${advisor.http.endpoint}") String endpoint,
                                            HttpClient httpClient,
                                            JacksonMapper mapper) {

        return new HttpProposalAdvisor(endpoint, httpClient, mapper);
    }

    @Bean
    EvaluationStore evaluationStore() {
        return new InMemoryEvaluationStore();
    }

    @Bean
    ProposalTracker proposalTracker() {
        return new ProposalTracker();
    }

    @Bean
    ProposalSerializer proposalSerializer() {
        return new ProposalSerializer();
    }

    @Bean
    ProposalRequestValidator proposalRequestValidator() {
        return new ProposalRequestValidator();
    }

    @Bean
    ProposalEvaluationService proposalEvaluationService(
            ProductCatalog productCatalog,
            ProposalRequestValidator proposalRequestValidator,
            AudienceValidator audienceValidator,
            @Autowired(required = false) EmbeddingService embeddingService,
            PricingRulesEngine pricingRulesEngine,
            AvailabilitySource availabilitySource,
            YieldOptimizer yieldOptimizer,
            @Autowired(required = false) HttpProposalAdvisor httpProposalAdvisor,
            RuleBasedProposalAdvisor ruleBasedProposalAdvisor,
            EvaluationStore evaluationStore,
            ProposalTracker proposalTracker,
            ProposalSerializer proposalSerializer,
            TimeoutExecutor timeoutExecutor,
            TimeoutFactory timeoutFactory,
            IdGenerator idGenerator,
            ProposalProperties proposalProperties,
            YieldProperties yieldProperties,
            JacksonMapper mapper,
            Metrics metrics,
            Clock clock) {

        final ProposalAdvisor proposalAdvisor = httpProposalAdvisor != null
                ? httpProposalAdvisor
                : ruleBasedProposalAdvisor;

        return new ProposalEvaluationService(
                productCatalog,
                proposalRequestValidator,
                audienceValidator,
                embeddingService,
                pricingRulesEngine,
                availabilitySource,
                yieldOptimizer,
                proposalAdvisor,
                ruleBasedProposalAdvisor,
                evaluationStore,
                proposalTracker,
                proposalSerializer,
                timeoutExecutor,
                timeoutFactory,
                idGenerator,
                proposalProperties.toSettings(yieldProperties),
                mapper,
                metrics,
                clock);
    }

    @Bean
    DealRecordBuilder dealRecordBuilder(IdGenerator idGenerator,
                                        Clock clock,
                                        TieredPricingConfig tieredPricingConfig) {

        return new DealRecordBuilder(idGenerator, clock, tieredPricingConfig.getSellerOrganizationId(),
                tieredPricingConfig.getDefaultCurrency());
    }

    @Bean
    DealService dealService(DealRecordBuilder dealRecordBuilder,
                            EvaluationStore evaluationStore,
                            TimeoutExecutor timeoutExecutor,
                            TimeoutFactory timeoutFactory,
                            ProposalProperties proposalProperties,
                            JacksonMapper mapper,
                            Metrics metrics,
                            Clock clock) {

        return new DealService(dealRecordBuilder, evaluationStore, timeoutExecutor, timeoutFactory,
                proposalProperties.getPersistenceTimeoutMs(), mapper, metrics, clock);
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class YieldProperties {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fillRateTarget = YieldOptimizer.DEFAULT_FILL_RATE_TARGET;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double currentFillRate = 0.75;

        @NotNull
        private BigDecimal defaultMarketCpm = BigDecimal.valueOf(15);

        private Map<String, BigDecimal> marketCpm;

        @NotNull
        private WeightProperties weights = new WeightProperties();

        YieldWeights toYieldWeights() {
            return YieldWeights.of(weights.getRevenue(), weights.getRelationship(), weights.getFillRate(),
                    weights.getPricingPower());
        }

        Map<String, BigDecimal> marketCpmByInventoryType() {
            return MapUtils.emptyIfNull(marketCpm).entrySet().stream()
                    .collect(Collectors.toUnmodifiableMap(
                            entry -> entry.getKey().toLowerCase(Locale.ROOT),
                            Map.Entry::getValue));
        }
    }

    @NoArgsConstructor
    @Data
    static class WeightProperties {

        private double revenue = 0.4;

        private double relationship = 0.3;

        private double fillRate = 0.2;

        private double pricingPower = 0.1;
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class ProposalProperties {

        @Min(1)
        private long evaluationTimeoutMs = 5000L;

        @Min(1)
        private long embeddingTimeoutMs = 1000L;

        @Min(1)
        private long availabilityTimeoutMs = 500L;

        @Min(1)
        private long advisorTimeoutMs = 2000L;

        @Min(1)
        private long persistenceTimeoutMs = 500L;

        ProposalEvaluationSettings toSettings(YieldProperties yieldProperties) {
            return ProposalEvaluationSettings.builder()
                    .evaluationTimeoutMs(evaluationTimeoutMs)
                    .embeddingTimeoutMs(embeddingTimeoutMs)
                    .availabilityTimeoutMs(availabilityTimeoutMs)
                    .advisorTimeoutMs(advisorTimeoutMs)
                    .persistenceTimeoutMs(persistenceTimeoutMs)
                    .currentFillRate(yieldProperties.getCurrentFillRate())
                    .defaultMarketCpm(yieldProperties.getDefaultMarketCpm())
                    .marketCpmByInventoryType(yieldProperties.marketCpmByInventoryType())
                    .build();
        }
    }
}
