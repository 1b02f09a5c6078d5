package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.buyer.AccessTier;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class PricingTier {

    AccessTier tier;

    String tierName;

    String description;

    boolean showExactPrice;

    @Builder.Default
    BigDecimal priceRangeVariance = new BigDecimal("0.2");

    @Builder.Default
    BigDecimal tierDiscount = BigDecimal.ZERO;

    boolean negotiationEnabled;

    boolean premiumInventoryAccess;

    boolean customDealsEnabled;

    boolean volumeDiscountsEnabled;

    @Builder.Default
    AvailsGranularity availsGranularity = AvailsGranularity.HIGH_LEVEL;
}
