package org.adseller.server.audience;

import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.SignalType;

import java.util.List;

/**
 * Capabilities assumed for products that do not declare their own.
 */
public class DefaultAudienceCapabilities {

    private static final int DEFAULT_DIMENSION = 512;

    private DefaultAudienceCapabilities() {
    }

    public static List<AudienceCapability> forProduct(String productId) {
        return List.of(
                capability(productId + "_ctx", "Contextual Targeting", "Page content and context signals",
                        SignalType.CONTEXTUAL, 95.0, List.of("news", "sports", "entertainment", "business")),
                capability(productId + "_geo", "Geographic Targeting", "Location-based targeting",
                        SignalType.CONTEXTUAL, 98.0, List.of("country", "region", "dma", "city")),
                capability(productId + "_demo", "Demographic Targeting", "Age and gender targeting",
                        SignalType.IDENTITY, 70.0, List.of("age_18_24", "age_25_34", "age_35_44", "male", "female")));
    }

    private static AudienceCapability capability(String id, String name, String description,
                                                 SignalType signalType, double coverage, List<String> segments) {
        return AudienceCapability.builder()
                .capabilityId(id)
                .name(name)
                .description(description)
                .signalType(signalType)
                .coveragePercentage(coverage)
                .availableSegments(segments)
                .ucpCompatible(true)
                .embeddingDimension(DEFAULT_DIMENSION)
                .build();
    }
}
