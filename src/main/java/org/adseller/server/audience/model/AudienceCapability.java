package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Audience targeting signal a product can serve, with the share of its inventory that carries the signal.
 */
@Value
@Builder(toBuilder = true)
public class AudienceCapability {

    String capabilityId;

    String name;

    String description;

    SignalType signalType;

    double coveragePercentage;

    @Builder.Default
    List<String> availableSegments = Collections.emptyList();

    String taxonomy;

    @Builder.Default
    double minimumMatchRate = 0.1;

    @Builder.Default
    boolean ucpCompatible = true;

    Integer embeddingDimension;
}
