package org.adseller.server.proposal.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.audience.model.Embedding;
import org.adseller.server.buyer.BuyerContext;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;

/**
 * Buyer proposal for a single product line. Product id, impressions, start and end date are required,
 * see {@link org.adseller.server.proposal.ProposalRequestValidator}.
 */
@Value
@Builder(toBuilder = true)
public class ProposalRequest {

    String proposalId;

    String lineId;

    String productId;

    /**
     * Requested deal type as sent by the buyer, aliases such as "pg" are accepted.
     */
    String dealType;

    BigDecimal price;

    Long impressions;

    LocalDate startDate;

    LocalDate endDate;

    String buyerOrganizationId;

    @Builder.Default
    BuyerContext buyerContext = BuyerContext.anonymous();

    @Builder.Default
    Map<String, Object> audienceTargeting = Collections.emptyMap();

    /**
     * Query embedding supplied by the buyer. When absent it is requested from the embedding service.
     */
    Embedding buyerEmbedding;

    public BuyerContext getBuyerContext() {
        return buyerContext != null ? buyerContext : BuyerContext.anonymous();
    }
}
