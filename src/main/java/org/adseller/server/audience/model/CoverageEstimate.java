package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class CoverageEstimate {

    double coveragePercentage;

    long estimatedImpressions;

    long totalImpressions;

    @Builder.Default
    List<String> matchedCapabilities = Collections.emptyList();

    CoverageConfidence confidence;

    @Builder.Default
    List<String> limitingFactors = Collections.emptyList();

    /**
     * Coverage factor per targeting key, filled by targeting-based estimates only.
     */
    Map<String, Double> targetingBreakdown;

    Boolean deliverable;
}
