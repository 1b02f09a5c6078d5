package org.adseller.server.yield.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class CounterTerms {

    BigDecimal proposedPrice;

    BigDecimal floorPrice;

    Long maxImpressions;

    /**
     * Additional discount the seller may still concede, present for strategic tiers only.
     */
    BigDecimal negotiationRoom;

    String reason;
}
