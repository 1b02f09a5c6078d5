package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Single rung of a volume discount ladder.
 */
@Value
@Builder(toBuilder = true)
public class VolumeDiscount {

    long minImpressions;

    Long maxImpressions;

    @Builder.Default
    DiscountType discountType = DiscountType.PERCENTAGE;

    BigDecimal discountValue;

    public boolean appliesTo(long volume) {
        return volume >= minImpressions && (maxImpressions == null || volume <= maxImpressions);
    }
}
