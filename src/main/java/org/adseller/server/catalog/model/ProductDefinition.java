package org.adseller.server.catalog.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.Embedding;
import org.adseller.server.deal.model.DealType;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ProductDefinition {

    String productId;

    String name;

    String description;

    String inventoryType;

    BigDecimal baseCpm;

    BigDecimal floorCpm;

    @Builder.Default
    String currency = "USD";

    @Builder.Default
    List<DealType> supportedDealTypes = List.of(DealType.PREFERRED_DEAL, DealType.PRIVATE_AUCTION);

    @Builder.Default
    List<String> supportedPricingModels = List.of("cpm");

    @Builder.Default
    long minimumImpressions = 10_000L;

    Long maximumImpressions;

    Map<String, Object> audienceTargeting;

    Map<String, Object> contentTargeting;

    /**
     * Empty means the product relies on default contextual, geographic and demographic capabilities.
     */
    @Builder.Default
    List<AudienceCapability> audienceCapabilities = Collections.emptyList();

    Embedding productEmbedding;

    public boolean supportsDealType(DealType dealType) {
        return dealType == null || supportedDealTypes == null || supportedDealTypes.contains(dealType);
    }
}
