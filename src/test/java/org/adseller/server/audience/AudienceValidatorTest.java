package org.adseller.server.audience;

import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.AudienceValidationResult;
import org.adseller.server.audience.model.CapabilityReport;
import org.adseller.server.audience.model.Consent;
import org.adseller.server.audience.model.Embedding;
import org.adseller.server.audience.model.GapAlternative;
import org.adseller.server.audience.model.SignalType;
import org.adseller.server.audience.model.ValidationStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class AudienceValidatorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final AudienceValidator target = new AudienceValidator(new SimilarityCalculator(),
            AudienceValidator.DEFAULT_MINIMUM_COVERAGE_THRESHOLD, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    public void validateShouldReturnInvalidWhenConsentIsMissing() {
        // given
        final Embedding buyer = SimilarityCalculatorTest.givenEmbedding(1.0, 0.0);

        // when
        final AudienceValidationResult result = target.validate(buyer, givenProduct(1.0, 0.0),
                DefaultAudienceCapabilities.forProduct("product-1"), Map.of());

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.INVALID);
        assertThat(result.isTargetingCompatible()).isFalse();
        assertThat(result.getOverallCoveragePercentage()).isZero();
        assertThat(result.getValidationNotes()).containsExactly("Missing or invalid consent");
    }

    @Test
    public void validateShouldReturnInvalidWhenConsentHasNoPermissibleUses() {
        // given
        final Embedding buyer = givenBuyer(1.0, 0.0).toBuilder()
                .consent(Consent.builder().permissibleUses(List.of()).build())
                .build();

        // when
        final AudienceValidationResult result = target.validate(buyer, givenProduct(1.0, 0.0), List.of(), null);

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.INVALID);
    }

    @Test
    public void validateShouldReturnInvalidWhenBuyerEmbeddingExpired() {
        // given
        final Embedding buyer = givenBuyer(1.0, 0.0).toBuilder()
                .timestamp(NOW.minusSeconds(7200))
                .ttlSeconds(3600)
                .build();

        // when
        final AudienceValidationResult result = target.validate(buyer, givenProduct(1.0, 0.0), List.of(), null);

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.INVALID);
        assertThat(result.getValidationNotes()).containsExactly("Buyer embedding expired");
    }

    @Test
    public void validateShouldReturnValidForMatchingAudience() {
        // given
        final List<AudienceCapability> capabilities = DefaultAudienceCapabilities.forProduct("product-1");

        // when
        final AudienceValidationResult result = target.validate(givenBuyer(1.0, 0.0), givenProduct(1.0, 0.0),
                capabilities, Map.of());

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.VALID);
        assertThat(result.isTargetingCompatible()).isTrue();
        assertThat(result.getOverallCoveragePercentage()).isCloseTo(100.0, within(1e-9));
        assertThat(result.getMatchedCapabilities())
                .containsExactly("product-1_ctx", "product-1_geo", "product-1_demo");
        assertThat(result.getEstimatedReach()).isEqualTo(3_000_000L);
        assertThat(result.getValidationNotes())
                .containsExactly("UCP similarity: 1.00", "Coverage: 100.0%", "Matched 3 of 3 capabilities");
        assertThat(result.getValidatedAt()).isEqualTo(NOW);
    }

    @Test
    public void validateShouldKeepPartialMatchAboveThirtyPercentIncompatible() {
        // when
        final AudienceValidationResult result = target.validate(givenBuyer(1.0, 0.0),
                givenProduct(0.4, Math.sqrt(1 - 0.16)), List.of(), null);

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.PARTIAL_MATCH);
        assertThat(result.getOverallCoveragePercentage()).isCloseTo(40.0, within(1e-6));
        assertThat(result.isTargetingCompatible()).isFalse();
        assertThat(result.getEstimatedReach()).isNull();
    }

    @Test
    public void validateShouldReturnPartialMatchForLowCoverage() {
        // when
        final AudienceValidationResult result = target.validate(givenBuyer(1.0, 0.0),
                givenProduct(0.1, Math.sqrt(1 - 0.01)), List.of(), null);

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.PARTIAL_MATCH);
        assertThat(result.isTargetingCompatible()).isFalse();
    }

    @Test
    public void validateShouldReturnNoMatchForOrthogonalEmbeddings() {
        // when
        final AudienceValidationResult result = target.validate(givenBuyer(1.0, 0.0), givenProduct(0.0, 1.0),
                List.of(), null);

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.NO_MATCH);
        assertThat(result.getOverallCoveragePercentage()).isZero();
        assertThat(result.isTargetingCompatible()).isFalse();
    }

    @Test
    public void validateShouldTreatMissingProductEmbeddingAsNoMatch() {
        // when
        final AudienceValidationResult result = target.validate(givenBuyer(1.0, 0.0), null, List.of(), null);

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.NO_MATCH);
    }

    @Test
    public void validateShouldReportGapsForUnsupportedSignals() {
        // given
        final List<AudienceCapability> capabilities = List.of(AudienceCapability.builder()
                .capabilityId("ctx")
                .name("Contextual")
                .signalType(SignalType.CONTEXTUAL)
                .coveragePercentage(90.0)
                .build());
        final Map<String, Object> requirements = Map.of(
                "demographics", List.of("age_25_34"),
                "interests", List.of("sports"),
                "behaviors", List.of("in_market_auto"));

        // when
        final AudienceValidationResult result = target.validate(givenBuyer(1.0, 0.0), givenProduct(1.0, 0.0),
                capabilities, requirements);

        // then
        assertThat(result.getGaps()).containsExactly("demographic_targeting", "behavioral_targeting");
        assertThat(result.getAlternatives()).containsExactly(
                GapAlternative.of("demographic_targeting", "Use contextual signals as proxy for demographics"),
                GapAlternative.of("behavioral_targeting", "Use contextual signals with frequency capping"));
    }

    @Test
    public void validateShouldIgnoreCapabilitiesThatAreNotUcpCompatible() {
        // given
        final List<AudienceCapability> capabilities = List.of(
                AudienceCapability.builder().capabilityId("a").coveragePercentage(80.0).build(),
                AudienceCapability.builder().capabilityId("b").coveragePercentage(80.0).ucpCompatible(false).build(),
                AudienceCapability.builder().capabilityId("c").coveragePercentage(0.0).build());

        // when
        final AudienceValidationResult result = target.validate(givenBuyer(1.0, 0.0), givenProduct(1.0, 0.0),
                capabilities, null);

        // then
        assertThat(result.getMatchedCapabilities()).containsExactly("a");
        assertThat(result.getEstimatedReach()).isEqualTo(2_000_000L);
    }

    @Test
    public void reportCapabilitiesShouldGroupBySignalType() {
        // when
        final CapabilityReport result = target.reportCapabilities(DefaultAudienceCapabilities.forProduct("p"));

        // then
        assertThat(result.getTotalCapabilities()).isEqualTo(3);
        assertThat(result.getUcpCompatibleCount()).isEqualTo(3);
        assertThat(result.getBySignalType()).containsOnlyKeys(SignalType.CONTEXTUAL, SignalType.IDENTITY);
        assertThat(result.getBySignalType().get(SignalType.CONTEXTUAL)).hasSize(2);
    }

    private static Embedding givenBuyer(Double... values) {
        return SimilarityCalculatorTest.givenEmbedding(values).toBuilder()
                .consent(Consent.builder().permissibleUses(List.of("personalization")).build())
                .timestamp(NOW)
                .build();
    }

    private static Embedding givenProduct(Double... values) {
        return SimilarityCalculatorTest.givenEmbedding(values);
    }
}
