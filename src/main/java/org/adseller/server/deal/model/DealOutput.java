package org.adseller.server.deal.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Deal record created from an accepted proposal. Carries pricing only, the campaign budget stays with the buyer.
 */
@Value
@Builder(toBuilder = true)
public class DealOutput {

    String dealId;

    DealType dealType;

    String proposalId;

    String productId;

    BigDecimal price;

    @Builder.Default
    String pricingModel = "cpm";

    String currency;

    /**
     * Present for programmatic guaranteed deals only.
     */
    Long guaranteedImpressions;

    /**
     * Present for preferred deals and private auctions only.
     */
    BigDecimal floorPrice;

    String openrtbDealId;

    Instant createdAt;

    String buyerOrganizationId;

    String sellerOrganizationId;

    LocalDate flightStart;

    LocalDate flightEnd;

    ActivationType activationType;

    @Builder.Default
    boolean dspCompatible = true;
}
