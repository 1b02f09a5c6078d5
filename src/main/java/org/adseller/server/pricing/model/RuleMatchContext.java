package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.buyer.AccessTier;

/**
 * Attributes of a pricing request that {@link PricingRule} predicates are evaluated against.
 */
@Value
@Builder
public class RuleMatchContext {

    AccessTier tier;

    String agencyId;

    String advertiserId;

    String holdingCompany;

    String productId;

    String inventoryType;
}
