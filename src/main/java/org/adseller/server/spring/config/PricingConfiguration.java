package org.adseller.server.spring.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.adseller.server.buyer.AccessTier;
import org.adseller.server.buyer.BuyerTierResolver;
import org.adseller.server.pricing.PricingConfigValidator;
import org.adseller.server.pricing.PricingRulesEngine;
import org.adseller.server.pricing.model.DiscountType;
import org.adseller.server.pricing.model.PricingRule;
import org.adseller.server.pricing.model.PricingTier;
import org.adseller.server.pricing.model.TieredPricingConfig;
import org.adseller.server.pricing.model.VolumeDiscount;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Configuration
public class PricingConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "seller")
    SellerProperties sellerProperties() {
        return new SellerProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "pricing")
    PricingProperties pricingProperties() {
        return new PricingProperties();
    }

    @Bean
    BuyerTierResolver buyerTierResolver() {
        return new BuyerTierResolver();
    }

    @Bean
    TieredPricingConfig tieredPricingConfig(SellerProperties sellerProperties, PricingProperties pricingProperties) {
        return PricingConfigValidator.validate(pricingProperties.toPricingConfig(
                sellerProperties.getOrganizationId(), sellerProperties.getCurrency()));
    }

    @Bean
    PricingRulesEngine pricingRulesEngine(TieredPricingConfig tieredPricingConfig,
                                          BuyerTierResolver buyerTierResolver,
                                          Clock clock) {

        return new PricingRulesEngine(tieredPricingConfig, buyerTierResolver, clock);
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class SellerProperties {

        @NotBlank
        private String organizationId;

        private String organizationName;

        @NotBlank
        private String currency = "USD";
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class PricingProperties {

        @NotNull
        @PositiveOrZero
        private BigDecimal globalFloorCpm = BigDecimal.ONE;

        private BigDecimal globalCeilingCpm;

        private boolean advertiserPricingConsistent = true;

        /**
         * Overrides of the default tier settings, only values that are set replace the defaults.
         */
        private Map<AccessTier, TierProperties> tiers;

        @Valid
        private List<RuleProperties> rules;

        TieredPricingConfig toPricingConfig(String sellerOrganizationId, String currency) {
            return TieredPricingConfig.builder()
                    .sellerOrganizationId(sellerOrganizationId)
                    .defaultCurrency(currency)
                    .globalFloorCpm(globalFloorCpm)
                    .globalCeilingCpm(globalCeilingCpm)
                    .advertiserPricingConsistent(advertiserPricingConsistent)
                    .tiers(mergeTiers())
                    .rules(ListUtils.emptyIfNull(rules).stream().map(RuleProperties::toPricingRule).toList())
                    .build();
        }

        private Map<AccessTier, PricingTier> mergeTiers() {
            final Map<AccessTier, PricingTier> merged = new EnumMap<>(TieredPricingConfig.defaultTiers());
            MapUtils.emptyIfNull(tiers).forEach((tier, overrides) ->
                    merged.put(tier, overrides.applyTo(merged.getOrDefault(tier,
                            PricingTier.builder().tier(tier).tierName(tier.toString()).build()))));
            return merged;
        }
    }

    @NoArgsConstructor
    @Data
    static class TierProperties {

        private Boolean showExactPrice;

        private BigDecimal priceRangeVariance;

        private BigDecimal tierDiscount;

        private Boolean negotiationEnabled;

        private Boolean volumeDiscountsEnabled;

        private Boolean premiumInventoryAccess;

        private Boolean customDealsEnabled;

        PricingTier applyTo(PricingTier tier) {
            return tier.toBuilder()
                    .showExactPrice(ObjectUtils.defaultIfNull(showExactPrice, tier.isShowExactPrice()))
                    .priceRangeVariance(ObjectUtils.defaultIfNull(priceRangeVariance, tier.getPriceRangeVariance()))
                    .tierDiscount(ObjectUtils.defaultIfNull(tierDiscount, tier.getTierDiscount()))
                    .negotiationEnabled(ObjectUtils.defaultIfNull(negotiationEnabled, tier.isNegotiationEnabled()))
                    .volumeDiscountsEnabled(ObjectUtils.defaultIfNull(volumeDiscountsEnabled,
                            tier.isVolumeDiscountsEnabled()))
                    .premiumInventoryAccess(ObjectUtils.defaultIfNull(premiumInventoryAccess,
                            tier.isPremiumInventoryAccess()))
                    .customDealsEnabled(ObjectUtils.defaultIfNull(customDealsEnabled, tier.isCustomDealsEnabled()))
                    .build();
        }
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class RuleProperties {

        @NotBlank
        private String ruleId;

        private String ruleName;

        private int priority;

        private AccessTier accessTier;

        private List<String> agencyIds;

        private List<String> advertiserIds;

        private List<String> holdingCompanyIds;

        private List<String> productIds;

        private List<String> inventoryTypes;

        private BigDecimal basePriceOverride;

        private BigDecimal discountPercentage;

        private BigDecimal priceFloor;

        private BigDecimal priceCeiling;

        private List<VolumeDiscountProperties> volumeDiscounts;

        private boolean negotiationEnabled;

        private BigDecimal maxNegotiationDiscount;

        private LocalDate validFrom;

        private LocalDate validTo;

        private boolean active = true;

        PricingRule toPricingRule() {
            final List<VolumeDiscount> ladder = new ArrayList<>();
            ListUtils.emptyIfNull(volumeDiscounts).forEach(rung -> ladder.add(rung.toVolumeDiscount()));

            return PricingRule.builder()
                    .ruleId(ruleId)
                    .ruleName(ObjectUtils.defaultIfNull(ruleName, ruleId))
                    .priority(priority)
                    .accessTier(accessTier)
                    .agencyIds(ListUtils.emptyIfNull(agencyIds))
                    .advertiserIds(ListUtils.emptyIfNull(advertiserIds))
                    .holdingCompanyIds(ListUtils.emptyIfNull(holdingCompanyIds))
                    .productIds(ListUtils.emptyIfNull(productIds))
                    .inventoryTypes(ListUtils.emptyIfNull(inventoryTypes))
                    .basePriceOverride(basePriceOverride)
                    .discountPercentage(ObjectUtils.defaultIfNull(discountPercentage, BigDecimal.ZERO))
                    .priceFloor(priceFloor)
                    .priceCeiling(priceCeiling)
                    .volumeDiscounts(List.copyOf(ladder))
                    .negotiationEnabled(negotiationEnabled)
                    .maxNegotiationDiscount(ObjectUtils.defaultIfNull(maxNegotiationDiscount, BigDecimal.ZERO))
                    .validFrom(validFrom)
                    .validTo(validTo)
                    .active(active)
                    .build();
        }
    }

    @NoArgsConstructor
    @Data
    static class VolumeDiscountProperties {

        private long minImpressions;

        private Long maxImpressions;

        private DiscountType discountType = DiscountType.PERCENTAGE;

        private BigDecimal discountValue;

        VolumeDiscount toVolumeDiscount() {
            return VolumeDiscount.builder()
                    .minImpressions(minImpressions)
                    .maxImpressions(maxImpressions)
                    .discountType(discountType)
                    .discountValue(discountValue)
                    .build();
        }
    }
}
