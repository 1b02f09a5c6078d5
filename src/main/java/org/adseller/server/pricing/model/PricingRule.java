package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.buyer.AccessTier;
import org.apache.commons.collections4.CollectionUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class PricingRule {

    String ruleId;

    String ruleName;

    int priority;

    AccessTier accessTier;

    @Builder.Default
    List<String> agencyIds = Collections.emptyList();

    @Builder.Default
    List<String> advertiserIds = Collections.emptyList();

    @Builder.Default
    List<String> holdingCompanyIds = Collections.emptyList();

    @Builder.Default
    List<String> productIds = Collections.emptyList();

    @Builder.Default
    List<String> inventoryTypes = Collections.emptyList();

    BigDecimal basePriceOverride;

    @Builder.Default
    BigDecimal discountPercentage = BigDecimal.ZERO;

    /**
     * Informational only, global bounds are enforced by {@link TieredPricingConfig}.
     */
    BigDecimal priceFloor;

    BigDecimal priceCeiling;

    @Builder.Default
    List<VolumeDiscount> volumeDiscounts = Collections.emptyList();

    boolean negotiationEnabled;

    @Builder.Default
    BigDecimal maxNegotiationDiscount = BigDecimal.ZERO;

    LocalDate validFrom;

    LocalDate validTo;

    @Builder.Default
    boolean active = true;

    public boolean matches(RuleMatchContext context) {
        return (accessTier == null || accessTier == context.getTier())
                && matchesAny(agencyIds, context.getAgencyId())
                && matchesAny(advertiserIds, context.getAdvertiserId())
                && matchesAny(holdingCompanyIds, context.getHoldingCompany())
                && matchesAny(productIds, context.getProductId())
                && matchesAny(inventoryTypes, context.getInventoryType());
    }

    public boolean isEffectiveOn(LocalDate date) {
        return active
                && (validFrom == null || !date.isBefore(validFrom))
                && (validTo == null || !date.isAfter(validTo));
    }

    private static boolean matchesAny(Collection<String> allowed, String value) {
        return CollectionUtils.isEmpty(allowed) || allowed.contains(value);
    }
}
