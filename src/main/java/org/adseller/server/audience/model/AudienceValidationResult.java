package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class AudienceValidationResult {

    ValidationStatus validationStatus;

    /**
     * Always within [0, 100].
     */
    double overallCoveragePercentage;

    @Builder.Default
    List<String> matchedCapabilities = Collections.emptyList();

    @Builder.Default
    List<String> gaps = Collections.emptyList();

    @Builder.Default
    List<GapAlternative> alternatives = Collections.emptyList();

    Double ucpSimilarityScore;

    boolean targetingCompatible;

    Long estimatedReach;

    @Builder.Default
    List<String> validationNotes = Collections.emptyList();

    Instant validatedAt;
}
