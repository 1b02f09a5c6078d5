package org.adseller.server.pricing;

import org.adseller.server.exception.InvalidConfigurationException;
import org.adseller.server.pricing.model.DiscountType;
import org.adseller.server.pricing.model.PricingRule;
import org.adseller.server.pricing.model.PricingTier;
import org.adseller.server.pricing.model.TieredPricingConfig;
import org.adseller.server.pricing.model.VolumeDiscount;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

public class PricingConfigValidator {

    private PricingConfigValidator() {
    }

    public static TieredPricingConfig validate(TieredPricingConfig config) {
        if (StringUtils.isBlank(config.getSellerOrganizationId())) {
            throw new InvalidConfigurationException("Pricing seller organization id must be present");
        }

        final BigDecimal floor = config.getGlobalFloorCpm();
        if (floor == null || floor.signum() < 0) {
            throw new InvalidConfigurationException(
                    "Pricing global floor must be a non-negative number, but was " + floor);
        }

        final BigDecimal ceiling = config.getGlobalCeilingCpm();
        if (ceiling != null && ceiling.compareTo(floor) < 0) {
            throw new InvalidConfigurationException(
                    "Pricing global ceiling %s must not be below global floor %s".formatted(ceiling, floor));
        }

        if (MapUtils.isEmpty(config.getTiers())) {
            throw new InvalidConfigurationException("Pricing tiers must be present");
        }
        config.getTiers().values().forEach(PricingConfigValidator::validateTier);

        final Set<String> ruleIds = new HashSet<>();
        for (PricingRule rule : config.getRules()) {
            validateRule(rule);
            if (!ruleIds.add(rule.getRuleId())) {
                throw new InvalidConfigurationException("Pricing rule id is duplicated: " + rule.getRuleId());
            }
        }

        return config;
    }

    private static void validateTier(PricingTier tier) {
        if (!isFraction(tier.getTierDiscount())) {
            throw new InvalidConfigurationException(
                    "Pricing tier %s discount must be in range [0, 1), but was %s"
                            .formatted(tier.getTier(), tier.getTierDiscount()));
        }
        if (!isFraction(tier.getPriceRangeVariance())) {
            throw new InvalidConfigurationException(
                    "Pricing tier %s price range variance must be in range [0, 1), but was %s"
                            .formatted(tier.getTier(), tier.getPriceRangeVariance()));
        }
    }

    private static void validateRule(PricingRule rule) {
        if (StringUtils.isBlank(rule.getRuleId())) {
            throw new InvalidConfigurationException("Pricing rule id must be present");
        }

        final String ruleId = rule.getRuleId();
        if (!isFraction(rule.getDiscountPercentage())) {
            throw new InvalidConfigurationException(
                    "Pricing rule %s discount must be in range [0, 1), but was %s"
                            .formatted(ruleId, rule.getDiscountPercentage()));
        }
        if (!isFraction(rule.getMaxNegotiationDiscount())) {
            throw new InvalidConfigurationException(
                    "Pricing rule %s max negotiation discount must be in range [0, 1), but was %s"
                            .formatted(ruleId, rule.getMaxNegotiationDiscount()));
        }
        if (rule.getBasePriceOverride() != null && rule.getBasePriceOverride().signum() < 0) {
            throw new InvalidConfigurationException(
                    "Pricing rule %s price override must be non-negative".formatted(ruleId));
        }
        if (rule.getValidFrom() != null && rule.getValidTo() != null
                && rule.getValidTo().isBefore(rule.getValidFrom())) {
            throw new InvalidConfigurationException(
                    "Pricing rule %s validity window ends before it starts".formatted(ruleId));
        }

        rule.getVolumeDiscounts().stream()
                .filter(Objects::nonNull)
                .forEach(rung -> validateVolumeDiscount(ruleId, rung));
    }

    private static void validateVolumeDiscount(String ruleId, VolumeDiscount rung) {
        if (rung.getMinImpressions() < 0) {
            throw new InvalidConfigurationException(
                    "Pricing rule %s volume discount min impressions must be non-negative".formatted(ruleId));
        }
        if (rung.getMaxImpressions() != null && rung.getMaxImpressions() < rung.getMinImpressions()) {
            throw new InvalidConfigurationException(
                    "Pricing rule %s volume discount max impressions must not be below min impressions"
                            .formatted(ruleId));
        }

        final BigDecimal value = rung.getDiscountValue();
        if (value == null || value.signum() < 0) {
            throw new InvalidConfigurationException(
                    "Pricing rule %s volume discount value must be non-negative".formatted(ruleId));
        }
        final boolean percentage = rung.getDiscountType() == null
                || rung.getDiscountType() == DiscountType.PERCENTAGE;
        if (percentage && !isFraction(value)) {
            throw new InvalidConfigurationException(
                    "Pricing rule %s volume discount percentage must be in range [0, 1), but was %s"
                            .formatted(ruleId, value));
        }
    }

    private static boolean isFraction(BigDecimal value) {
        return value == null || value.signum() >= 0 && value.compareTo(BigDecimal.ONE) < 0;
    }
}
