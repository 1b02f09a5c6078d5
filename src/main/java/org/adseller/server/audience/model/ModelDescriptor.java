package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelDescriptor {

    String id;

    String version;

    int dimension;

    @Builder.Default
    SimilarityMetric metric = SimilarityMetric.COSINE;

    @Builder.Default
    String embeddingSpaceId = "iab-ucp-v1";
}
