package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.buyer.AccessTier;
import org.adseller.server.deal.model.DealType;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class PricingDecision {

    String productId;

    DealType dealType;

    AccessTier buyerTier;

    String pricingKey;

    BigDecimal basePrice;

    BigDecimal tierDiscount;

    BigDecimal ruleDiscount;

    BigDecimal volumeDiscount;

    BigDecimal finalPrice;

    String currency;

    String pricingModel;

    String rationale;

    /**
     * Ordered trail of the steps that changed the price.
     */
    List<String> appliedRules;
}
