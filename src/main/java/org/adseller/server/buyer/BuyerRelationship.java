package org.adseller.server.buyer;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Historical relationship between the seller and a buyer.
 */
@Value
@Builder(toBuilder = true)
public class BuyerRelationship {

    String buyerId;

    String buyerType;

    BigDecimal totalSpend;

    BigDecimal spendYtd;

    BigDecimal spendLast12Months;

    int totalDeals;

    int activeDeals;

    int completedDeals;

    AccessTier relationshipTier;

    Double averageFillRate;

    BigDecimal averageCpm;

    @Builder.Default
    PaymentHistory paymentHistory = PaymentHistory.UNKNOWN;

    List<String> preferredInventoryTypes;

    List<String> blockedCategories;
}
