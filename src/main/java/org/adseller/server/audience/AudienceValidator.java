package org.adseller.server.audience;

import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.AudienceValidationResult;
import org.adseller.server.audience.model.CapabilityReport;
import org.adseller.server.audience.model.Embedding;
import org.adseller.server.audience.model.GapAlternative;
import org.adseller.server.audience.model.SignalType;
import org.adseller.server.audience.model.ValidationStatus;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.ObjectUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Validates a buyer audience against product inventory by embedding similarity and declared capabilities.
 */
public class AudienceValidator {

    public static final double DEFAULT_MINIMUM_COVERAGE_THRESHOLD = 50.0;

    private static final double PARTIAL_MATCH_THRESHOLD = 30.0;
    private static final long IMPRESSIONS_PER_CAPABILITY = 1_000_000L;

    private static final String DEMOGRAPHICS = "demographics";
    private static final String INTERESTS = "interests";
    private static final String BEHAVIORS = "behaviors";

    private final SimilarityCalculator similarityCalculator;
    private final double minimumCoverageThreshold;
    private final Clock clock;

    public AudienceValidator(SimilarityCalculator similarityCalculator, double minimumCoverageThreshold, Clock clock) {
        this.similarityCalculator = Objects.requireNonNull(similarityCalculator);
        this.minimumCoverageThreshold = minimumCoverageThreshold;
        this.clock = Objects.requireNonNull(clock);
    }

    public double getMinimumCoverageThreshold() {
        return minimumCoverageThreshold;
    }

    public AudienceValidationResult validate(Embedding buyerEmbedding,
                                             Embedding productEmbedding,
                                             List<AudienceCapability> capabilities,
                                             Map<String, Object> requirements) {

        if (buyerEmbedding == null || buyerEmbedding.getConsent() == null
                || !buyerEmbedding.getConsent().hasPermissibleUse()) {
            return invalid("Missing or invalid consent");
        }
        if (buyerEmbedding.isExpired(clock)) {
            return invalid("Buyer embedding expired");
        }

        final List<AudienceCapability> safeCapabilities = ObjectUtils.defaultIfNull(capabilities,
                Collections.emptyList());

        final double similarity = productEmbedding != null
                ? similarityCalculator.similarity(buyerEmbedding, productEmbedding)
                : 0.0;
        final double coverage = similarity * 100;

        final List<String> matchedCapabilities = safeCapabilities.stream()
                .filter(capability -> capability.isUcpCompatible() && capability.getCoveragePercentage() > 0)
                .map(AudienceCapability::getCapabilityId)
                .toList();

        final List<String> gaps = new ArrayList<>();
        final List<GapAlternative> alternatives = new ArrayList<>();
        if (MapUtils.isNotEmpty(requirements)) {
            analyzeGaps(requirements, safeCapabilities, gaps, alternatives);
        }

        final ValidationStatus status;
        final boolean compatible;
        if (coverage >= minimumCoverageThreshold) {
            status = ValidationStatus.VALID;
            compatible = true;
        } else if (coverage >= PARTIAL_MATCH_THRESHOLD) {
            status = ValidationStatus.PARTIAL_MATCH;
            // false within this branch, partial matches above 30% are kept as not compatible
            compatible = coverage >= minimumCoverageThreshold;
        } else if (coverage > 0) {
            status = ValidationStatus.PARTIAL_MATCH;
            compatible = false;
        } else {
            status = ValidationStatus.NO_MATCH;
            compatible = false;
        }

        return AudienceValidationResult.builder()
                .validationStatus(status)
                .overallCoveragePercentage(coverage)
                .matchedCapabilities(matchedCapabilities)
                .gaps(Collections.unmodifiableList(gaps))
                .alternatives(Collections.unmodifiableList(alternatives))
                .ucpSimilarityScore(similarity)
                .targetingCompatible(compatible)
                .estimatedReach(estimatedReach(safeCapabilities, coverage))
                .validationNotes(List.of(
                        String.format(Locale.ROOT, "UCP similarity: %.2f", similarity),
                        String.format(Locale.ROOT, "Coverage: %.1f%%", coverage),
                        "Matched %d of %d capabilities".formatted(matchedCapabilities.size(),
                                safeCapabilities.size())))
                .validatedAt(clock.instant())
                .build();
    }

    public CapabilityReport reportCapabilities(List<AudienceCapability> capabilities) {
        final List<AudienceCapability> safeCapabilities = ObjectUtils.defaultIfNull(capabilities,
                Collections.emptyList());

        final Map<SignalType, List<CapabilityReport.CapabilitySummary>> bySignalType = safeCapabilities.stream()
                .filter(capability -> capability.getSignalType() != null)
                .collect(Collectors.groupingBy(
                        AudienceCapability::getSignalType,
                        () -> new EnumMap<>(SignalType.class),
                        Collectors.mapping(capability -> CapabilityReport.CapabilitySummary.of(
                                        capability.getCapabilityId(),
                                        capability.getName(),
                                        capability.getCoveragePercentage(),
                                        capability.isUcpCompatible()),
                                Collectors.toList())));

        final long ucpCompatibleCount = safeCapabilities.stream()
                .filter(AudienceCapability::isUcpCompatible)
                .count();

        return CapabilityReport.of(safeCapabilities, bySignalType, safeCapabilities.size(), ucpCompatibleCount);
    }

    private static void analyzeGaps(Map<String, Object> requirements,
                                    List<AudienceCapability> capabilities,
                                    List<String> gaps,
                                    List<GapAlternative> alternatives) {

        if (isPresent(requirements.get(DEMOGRAPHICS)) && !hasSignal(capabilities, SignalType.IDENTITY)) {
            gaps.add("demographic_targeting");
            alternatives.add(GapAlternative.of("demographic_targeting",
                    "Use contextual signals as proxy for demographics"));
        }

        if (isPresent(requirements.get(INTERESTS)) && !hasSignal(capabilities, SignalType.CONTEXTUAL)) {
            gaps.add("interest_targeting");
            alternatives.add(GapAlternative.of("interest_targeting",
                    "Use content category targeting as proxy for interests"));
        }

        if (isPresent(requirements.get(BEHAVIORS)) && !hasSignal(capabilities, SignalType.REINFORCEMENT)) {
            gaps.add("behavioral_targeting");
            alternatives.add(GapAlternative.of("behavioral_targeting",
                    "Use contextual signals with frequency capping"));
        }
    }

    private static boolean hasSignal(List<AudienceCapability> capabilities, SignalType signalType) {
        return capabilities.stream().anyMatch(capability -> capability.getSignalType() == signalType);
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        } else if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        } else if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        } else if (value instanceof String string) {
            return !string.isBlank();
        }
        return true;
    }

    private static Long estimatedReach(List<AudienceCapability> capabilities, double coverage) {
        if (CollectionUtils.isEmpty(capabilities)) {
            return null;
        }

        final long totalInventory = capabilities.stream()
                .filter(capability -> capability.getCoveragePercentage() > 0)
                .count() * IMPRESSIONS_PER_CAPABILITY;
        return (long) (totalInventory * (coverage / 100));
    }

    private AudienceValidationResult invalid(String note) {
        return AudienceValidationResult.builder()
                .validationStatus(ValidationStatus.INVALID)
                .overallCoveragePercentage(0.0)
                .targetingCompatible(false)
                .validationNotes(List.of(note))
                .validatedAt(clock.instant())
                .build();
    }
}
