package org.adseller.server.proposal.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.pricing.model.PricingDecision;
import org.adseller.server.yield.model.CounterTerms;
import org.adseller.server.yield.model.Recommendation;
import org.adseller.server.yield.model.UpsellSuggestion;
import org.adseller.server.yield.model.YieldScore;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Seller-side assessment of a single proposal line.
 */
@Value
@Builder(toBuilder = true)
public class ProposalEvaluation {

    String proposalId;

    String proposalLineId;

    String productId;

    Instant evaluatedAt;

    @Builder.Default
    boolean valid = true;

    @Builder.Default
    List<String> validationErrors = Collections.emptyList();

    BigDecimal requestedPrice;

    BigDecimal minimumAcceptablePrice;

    BigDecimal recommendedPrice;

    boolean priceAcceptable;

    String priceReason;

    PricingDecision pricingDecision;

    long requestedImpressions;

    long availableImpressions;

    boolean impressionsAvailable;

    @Builder.Default
    boolean targetingCompatible = true;

    @Builder.Default
    List<String> targetingNotes = Collections.emptyList();

    boolean audienceValidated;

    double audienceCoverage;

    @Builder.Default
    List<String> audienceGaps = Collections.emptyList();

    Double ucpSimilarityScore;

    YieldScore yieldScore;

    Recommendation recommendation;

    CounterTerms counterTerms;

    String rejectionReason;

    @Builder.Default
    List<UpsellSuggestion> upsellOpportunities = Collections.emptyList();
}
