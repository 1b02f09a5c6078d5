package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.buyer.AccessTier;

import java.math.BigDecimal;

/**
 * Price as disclosed to a buyer: an exact value for identified tiers, a range otherwise.
 */
@Value
@Builder
public class PriceDisplay {

    AccessTier tier;

    boolean exact;

    BigDecimal price;

    BigDecimal priceLow;

    BigDecimal priceHigh;

    String currency;

    boolean negotiable;

    String display;
}
