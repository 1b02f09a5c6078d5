package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.buyer.AccessTier;
import org.apache.commons.collections4.MapUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Seller-wide pricing configuration. Built once at startup and shared read-only by every evaluation.
 */
@Value
@Builder(toBuilder = true)
public class TieredPricingConfig {

    String sellerOrganizationId;

    @Builder.Default
    Map<AccessTier, PricingTier> tiers = defaultTiers();

    @Builder.Default
    List<PricingRule> rules = Collections.emptyList();

    @Builder.Default
    String defaultCurrency = "USD";

    @Builder.Default
    BigDecimal globalFloorCpm = BigDecimal.ONE;

    BigDecimal globalCeilingCpm;

    /**
     * When set, an advertiser gets the same price whichever agency buys on its behalf.
     */
    @Builder.Default
    boolean advertiserPricingConsistent = true;

    public PricingTier tierConfig(AccessTier tier) {
        final PricingTier tierConfig = MapUtils.isNotEmpty(tiers) ? tiers.get(tier) : null;
        if (tierConfig != null) {
            return tierConfig;
        }

        final PricingTier publicTier = MapUtils.isNotEmpty(tiers) ? tiers.get(AccessTier.PUBLIC) : null;
        return publicTier != null ? publicTier : DefaultTiers.PUBLIC;
    }

    /**
     * Returns rules in effect on the given date that match the context, highest priority first.
     */
    public List<PricingRule> findMatchingRules(RuleMatchContext context, LocalDate date) {
        return rules.stream()
                .filter(rule -> rule.isEffectiveOn(date))
                .filter(rule -> rule.matches(context))
                .sorted(Comparator.comparingInt(PricingRule::getPriority).reversed())
                .collect(Collectors.toList());
    }

    public static Map<AccessTier, PricingTier> defaultTiers() {
        final Map<AccessTier, PricingTier> tiers = new EnumMap<>(AccessTier.class);
        tiers.put(AccessTier.PUBLIC, DefaultTiers.PUBLIC);
        tiers.put(AccessTier.SEAT, DefaultTiers.SEAT);
        tiers.put(AccessTier.AGENCY, DefaultTiers.AGENCY);
        tiers.put(AccessTier.ADVERTISER, DefaultTiers.ADVERTISER);
        return Collections.unmodifiableMap(tiers);
    }

    private static final class DefaultTiers {

        private static final PricingTier PUBLIC = PricingTier.builder()
                .tier(AccessTier.PUBLIC)
                .tierName("Public")
                .description("General product catalog with price ranges")
                .showExactPrice(false)
                .priceRangeVariance(new BigDecimal("0.2"))
                .tierDiscount(BigDecimal.ZERO)
                .availsGranularity(AvailsGranularity.HIGH_LEVEL)
                .build();

        private static final PricingTier SEAT = PricingTier.builder()
                .tier(AccessTier.SEAT)
                .tierName("Seat")
                .description("Authenticated DSP seat with fixed prices")
                .showExactPrice(true)
                .tierDiscount(new BigDecimal("0.05"))
                .customDealsEnabled(true)
                .availsGranularity(AvailsGranularity.MODERATE)
                .build();

        private static final PricingTier AGENCY = PricingTier.builder()
                .tier(AccessTier.AGENCY)
                .tierName("Agency")
                .description("Agency-level access with negotiation and premium inventory")
                .showExactPrice(true)
                .tierDiscount(new BigDecimal("0.10"))
                .negotiationEnabled(true)
                .premiumInventoryAccess(true)
                .customDealsEnabled(true)
                .volumeDiscountsEnabled(true)
                .availsGranularity(AvailsGranularity.DETAILED)
                .build();

        private static final PricingTier ADVERTISER = PricingTier.builder()
                .tier(AccessTier.ADVERTISER)
                .tierName("Advertiser")
                .description("Advertiser-specific pricing with the best rates")
                .showExactPrice(true)
                .tierDiscount(new BigDecimal("0.15"))
                .negotiationEnabled(true)
                .premiumInventoryAccess(true)
                .customDealsEnabled(true)
                .volumeDiscountsEnabled(true)
                .availsGranularity(AvailsGranularity.DETAILED)
                .build();

        private DefaultTiers() {
        }
    }
}
