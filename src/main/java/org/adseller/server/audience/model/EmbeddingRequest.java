package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Payload asking the embedding service for a buyer query or product inventory embedding.
 */
@Value
@Builder
public class EmbeddingRequest {

    EmbeddingType embeddingType;

    String productId;

    String inventoryType;

    Map<String, Object> audienceTargeting;

    Map<String, Object> contentTargeting;
}
