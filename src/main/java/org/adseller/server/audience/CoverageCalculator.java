package org.adseller.server.audience;

import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.CoverageConfidence;
import org.adseller.server.audience.model.CoverageEstimate;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.MapUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Estimates reachable impressions assuming targeting signals are independent of each other.
 */
public class CoverageCalculator {

    public static final long DEFAULT_TOTAL_IMPRESSIONS = 1_000_000L;

    private static final double MIN_COMBINED_COVERAGE = 0.01;
    private static final double LIMITING_CAPABILITY_COVERAGE = 50.0;
    private static final double LIMITING_TARGETING_FACTOR = 0.5;
    private static final double DELIVERABLE_COVERAGE = 0.05;
    private static final double UNKNOWN_TARGETING_FACTOR = 0.80;

    private static final Map<String, Double> TARGETING_FACTORS;

    static {
        final Map<String, Double> factors = new LinkedHashMap<>();
        // contextual
        factors.put("geography", 0.95);
        factors.put("geo", 0.95);
        factors.put("device", 0.99);
        factors.put("device_type", 0.99);
        factors.put("content_categories", 0.90);
        factors.put("keywords", 0.85);
        factors.put("language", 0.98);
        factors.put("daypart", 1.0);
        factors.put("time_of_day", 1.0);
        // identity
        factors.put("demographics", 0.70);
        factors.put("age", 0.72);
        factors.put("gender", 0.68);
        factors.put("income", 0.55);
        factors.put("education", 0.50);
        // behavioral
        factors.put("behaviors", 0.35);
        factors.put("interests", 0.45);
        factors.put("intent", 0.35);
        factors.put("in_market", 0.35);
        factors.put("retargeting", 0.20);
        factors.put("custom_audience", 0.25);
        TARGETING_FACTORS = Collections.unmodifiableMap(factors);
    }

    /**
     * Combines coverage of every capability that carries any inventory.
     */
    public CoverageEstimate calculateCoverage(Map<String, Object> targeting,
                                              List<AudienceCapability> capabilities,
                                              Long totalImpressions) {

        final long total = totalImpressions != null ? totalImpressions : DEFAULT_TOTAL_IMPRESSIONS;
        final List<AudienceCapability> matched = CollectionUtils.emptyIfNull(capabilities).stream()
                .filter(capability -> capability.getCoveragePercentage() > 0)
                .toList();

        if (matched.isEmpty()) {
            return CoverageEstimate.builder()
                    .coveragePercentage(0.0)
                    .estimatedImpressions(0L)
                    .totalImpressions(total)
                    .confidence(CoverageConfidence.LOW)
                    .build();
        }

        double combined = 1.0;
        for (AudienceCapability capability : matched) {
            combined *= capability.getCoveragePercentage() / 100;
        }
        combined = Math.max(combined, MIN_COMBINED_COVERAGE);

        return CoverageEstimate.builder()
                .coveragePercentage(combined * 100)
                .estimatedImpressions((long) (total * combined))
                .totalImpressions(total)
                .matchedCapabilities(matched.stream().map(AudienceCapability::getCapabilityId).toList())
                .confidence(matched.size() > 1 ? CoverageConfidence.HIGH : CoverageConfidence.MEDIUM)
                .limitingFactors(matched.stream()
                        .filter(capability -> capability.getCoveragePercentage() < LIMITING_CAPABILITY_COVERAGE)
                        .map(AudienceCapability::getName)
                        .toList())
                .build();
    }

    /**
     * Estimates coverage from targeting dimensions alone, using typical inventory share per dimension.
     */
    public CoverageEstimate estimateTargetingCoverage(Map<String, Object> targeting, long totalInventory) {
        final Map<String, Double> breakdown = new LinkedHashMap<>();
        final List<String> limitingFactors = new ArrayList<>();

        if (MapUtils.isNotEmpty(targeting)) {
            for (Map.Entry<String, Object> entry : targeting.entrySet()) {
                if (!isPresent(entry.getValue())) {
                    continue;
                }

                final double factor = targetingFactor(entry.getKey());
                breakdown.put(entry.getKey(), factor);
                if (factor < LIMITING_TARGETING_FACTOR) {
                    limitingFactors.add(String.format(Locale.ROOT, "%s (%.0f%% coverage)",
                            entry.getKey(), factor * 100));
                }
            }
        }

        double combined = 1.0;
        if (!breakdown.isEmpty()) {
            for (double factor : breakdown.values()) {
                combined *= factor;
            }
            combined = Math.max(combined, MIN_COMBINED_COVERAGE);
        }

        return CoverageEstimate.builder()
                .coveragePercentage(combined * 100)
                .estimatedImpressions((long) (totalInventory * combined))
                .totalImpressions(totalInventory)
                .confidence(confidence(breakdown.size()))
                .limitingFactors(Collections.unmodifiableList(limitingFactors))
                .targetingBreakdown(Collections.unmodifiableMap(breakdown))
                .deliverable(combined >= DELIVERABLE_COVERAGE)
                .build();
    }

    private static double targetingFactor(String key) {
        final String normalized = key.toLowerCase(Locale.ROOT).replace('-', '_');
        return TARGETING_FACTORS.entrySet().stream()
                .filter(factor -> normalized.contains(factor.getKey()) || factor.getKey().contains(normalized))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(UNKNOWN_TARGETING_FACTOR);
    }

    private static CoverageConfidence confidence(int layers) {
        if (layers <= 2) {
            return CoverageConfidence.HIGH;
        }
        return layers <= 4 ? CoverageConfidence.MEDIUM : CoverageConfidence.LOW;
    }

    private static boolean isPresent(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        } else if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        } else if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        } else if (value instanceof String string) {
            return !string.isEmpty();
        }
        return true;
    }
}
