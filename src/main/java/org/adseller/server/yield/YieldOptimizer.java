package org.adseller.server.yield;

import org.adseller.server.buyer.AccessTier;
import org.adseller.server.buyer.BuyerContext;
import org.adseller.server.buyer.BuyerRelationship;
import org.adseller.server.buyer.BuyerTierResolver;
import org.adseller.server.buyer.PaymentHistory;
import org.adseller.server.proposal.model.ProposalEvaluation;
import org.adseller.server.yield.model.CounterTerms;
import org.adseller.server.yield.model.Recommendation;
import org.adseller.server.yield.model.UpsellSuggestion;
import org.adseller.server.yield.model.UpsellType;
import org.adseller.server.yield.model.YieldAction;
import org.adseller.server.yield.model.YieldRecommendation;
import org.adseller.server.yield.model.YieldScore;
import org.adseller.server.yield.model.YieldWeights;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores how attractive a deal is for the seller, balancing immediate revenue, buyer relationship,
 * inventory fill and market pricing power.
 */
public class YieldOptimizer {

    public static final double DEFAULT_FILL_RATE_TARGET = 0.85;

    private static final double ACCEPT_THRESHOLD = 0.7;
    private static final double ACCEPTABLE_THRESHOLD = 0.5;
    private static final double COUNTER_THRESHOLD = 0.3;

    private static final BigDecimal STRATEGIC_NEGOTIATION_ROOM = new BigDecimal("0.05");
    private static final double COUNTER_CONFIDENCE = 0.7;
    private static final double UPSELL_CONFIDENCE = 0.6;
    private static final double NO_UPSELL_CONFIDENCE = 0.5;

    private final YieldWeights weights;
    private final double fillRateTarget;
    private final BuyerTierResolver tierResolver;

    public YieldOptimizer(YieldWeights weights, double fillRateTarget, BuyerTierResolver tierResolver) {
        this.weights = Objects.requireNonNull(weights).validate();
        this.fillRateTarget = fillRateTarget;
        this.tierResolver = Objects.requireNonNull(tierResolver);
    }

    public YieldScore scoreDeal(ProposalEvaluation evaluation,
                                BuyerContext buyerContext,
                                double currentFillRate,
                                BigDecimal marketCpm) {

        final double offered = toDouble(evaluation.getRequestedPrice());
        final double revenueScore = revenueScore(offered, toDouble(evaluation.getRecommendedPrice()));
        final double relationshipScore = relationshipScore(buyerContext);
        final double fillRateImpact = fillRateImpact(currentFillRate, evaluation.isImpressionsAvailable());
        final double pricingPowerImpact = pricingPowerImpact(offered, toDouble(marketCpm));

        final double overallScore = revenueScore * weights.getRevenue()
                + relationshipScore * weights.getRelationship()
                + fillRateImpact * weights.getFillRate()
                + pricingPowerImpact * weights.getPricingPower();

        final Decision decision = decide(overallScore, evaluation, revenueScore, relationshipScore);

        return YieldScore.builder()
                .overallScore(overallScore)
                .revenueScore(revenueScore)
                .relationshipScore(relationshipScore)
                .fillRateImpact(fillRateImpact)
                .pricingPowerImpact(pricingPowerImpact)
                .recommendation(decision.recommendation())
                .rationale(decision.rationale())
                .build();
    }

    public YieldRecommendation recommendCounterTerms(ProposalEvaluation evaluation, BuyerContext buyerContext) {
        final CounterTerms.CounterTermsBuilder terms = CounterTerms.builder();
        final List<String> rationale = new ArrayList<>();

        if (!evaluation.isPriceAcceptable() && evaluation.getRecommendedPrice() != null) {
            terms.proposedPrice(evaluation.getRecommendedPrice());
            rationale.add(String.format(Locale.ROOT, "Increase price to $%.2f CPM",
                    evaluation.getRecommendedPrice()));
        }

        if (evaluation.getRequestedImpressions() > evaluation.getAvailableImpressions()) {
            terms.maxImpressions(evaluation.getAvailableImpressions());
            rationale.add(String.format(Locale.ROOT, "Reduce impressions to %,d",
                    evaluation.getAvailableImpressions()));
        }

        if (isStrategic(tierResolver.resolveTier(buyerContext))) {
            terms.negotiationRoom(STRATEGIC_NEGOTIATION_ROOM);
            rationale.add("Strategic buyer - limited negotiation available");
        }

        final String reason = rationale.isEmpty() ? "Standard counter terms" : String.join("; ", rationale);
        return YieldRecommendation.builder()
                .action(YieldAction.COUNTER)
                .confidence(COUNTER_CONFIDENCE)
                .rationale(reason)
                .counterTerms(terms.reason(reason).build())
                .build();
    }

    /**
     * Suggests upsells. Product types are compared case-insensitively, cross-sell follows the
     * display to video to CTV adjacency.
     */
    public YieldRecommendation identifyUpsell(ProposalEvaluation evaluation,
                                              BuyerContext buyerContext,
                                              String productType,
                                              Collection<String> availableProductTypes) {

        final List<UpsellSuggestion> opportunities = new ArrayList<>();

        if (evaluation.isImpressionsAvailable()) {
            opportunities.add(UpsellSuggestion.of(UpsellType.VOLUME_UPGRADE,
                    "Volume upgrade: Add 20% more impressions at 10% volume discount"));
        }

        if (CollectionUtils.isNotEmpty(availableProductTypes) && StringUtils.isNotEmpty(productType)) {
            final String type = productType.toLowerCase(Locale.ROOT);
            final boolean videoAvailable = containsType(availableProductTypes, "video");
            final boolean ctvAvailable = containsType(availableProductTypes, "ctv");

            if (type.contains("display") && videoAvailable) {
                opportunities.add(UpsellSuggestion.of(UpsellType.CROSS_SELL,
                        "Cross-sell: Add video for higher engagement and brand lift"));
            }
            if (type.contains("display") && ctvAvailable) {
                opportunities.add(UpsellSuggestion.of(UpsellType.CROSS_SELL,
                        "Cross-sell: Extend to CTV for full-funnel coverage"));
            }
            if (type.contains("video") && ctvAvailable) {
                opportunities.add(UpsellSuggestion.of(UpsellType.CROSS_SELL,
                        "Cross-sell: Add CTV for household-level reach"));
            }
        }

        if (tierResolver.resolveTier(buyerContext) != AccessTier.PUBLIC) {
            opportunities.add(UpsellSuggestion.of(UpsellType.COMMITMENT_BONUS,
                    "Commitment bonus: Lock in Q2 now for preferred pricing"));
        }

        if (opportunities.isEmpty()) {
            return YieldRecommendation.builder()
                    .action(YieldAction.NONE)
                    .confidence(NO_UPSELL_CONFIDENCE)
                    .rationale("No strong upsell opportunities identified")
                    .build();
        }

        return YieldRecommendation.builder()
                .action(YieldAction.UPSELL)
                .confidence(UPSELL_CONFIDENCE)
                .rationale("Upsell opportunities identified based on buyer profile and inventory")
                .upsellOpportunities(List.copyOf(opportunities))
                .build();
    }

    static double revenueScore(double offered, double recommended) {
        if (recommended <= 0) {
            return 0.5;
        }

        final double ratio = offered / recommended;
        if (ratio >= 1.0) {
            return Math.min(1.0, 0.8 + (ratio - 1.0) * 0.2);
        } else if (ratio >= 0.9) {
            return 0.6 + (ratio - 0.9) * 2;
        } else if (ratio >= 0.8) {
            return 0.4 + (ratio - 0.8) * 2;
        }
        return Math.max(0.0, ratio * 0.5);
    }

    double relationshipScore(BuyerContext buyerContext) {
        double score = switch (tierResolver.resolveTier(buyerContext)) {
            case PUBLIC -> 0.2;
            case SEAT -> 0.4;
            case AGENCY -> 0.6;
            case ADVERTISER -> 0.8;
        };

        final BuyerRelationship relationship = buyerContext.relationship().orElse(null);
        if (relationship != null) {
            final double totalSpend = toDouble(relationship.getTotalSpend());
            if (totalSpend > 1_000_000) {
                score += 0.15;
            } else if (totalSpend > 100_000) {
                score += 0.10;
            }

            if (relationship.getActiveDeals() > 5) {
                score += 0.05;
            }

            if (relationship.getPaymentHistory() == PaymentHistory.EXCELLENT) {
                score += 0.05;
            }
        }

        return Math.min(1.0, score);
    }

    double fillRateImpact(double currentFillRate, boolean impressionsAvailable) {
        if (!impressionsAvailable) {
            return 0.0;
        }

        if (currentFillRate < fillRateTarget) {
            final double gap = fillRateTarget - currentFillRate;
            return Math.min(1.0, 0.5 + gap * 2);
        }
        return Math.max(0.3, 1.0 - (currentFillRate - fillRateTarget) * 2);
    }

    static double pricingPowerImpact(double offered, double marketCpm) {
        if (marketCpm <= 0) {
            return 0.5;
        }

        final double ratio = offered / marketCpm;
        if (ratio >= 1.0) {
            return Math.min(1.0, 0.7 + (ratio - 1.0) * 0.3);
        } else if (ratio >= 0.9) {
            return 0.5 + (ratio - 0.9) * 2;
        }
        return Math.max(0.2, ratio * 0.5);
    }

    private static Decision decide(double overallScore,
                                   ProposalEvaluation evaluation,
                                   double revenueScore,
                                   double relationshipScore) {

        if (!evaluation.isValid()) {
            return new Decision(Recommendation.REJECT,
                    "Invalid proposal: " + String.join(", ", evaluation.getValidationErrors()));
        }

        if (!evaluation.isImpressionsAvailable()) {
            return new Decision(Recommendation.REJECT, "Insufficient inventory availability");
        }

        if (overallScore >= ACCEPT_THRESHOLD) {
            return new Decision(Recommendation.ACCEPT, String.format(Locale.ROOT,
                    "Strong yield opportunity (score: %.2f). Revenue: %.2f, Relationship: %.2f",
                    overallScore, revenueScore, relationshipScore));
        } else if (overallScore >= ACCEPTABLE_THRESHOLD) {
            if (revenueScore < 0.5 && relationshipScore >= 0.6) {
                return new Decision(Recommendation.COUNTER,
                        "Strategic buyer but price needs improvement. "
                                + "Counter with recommended price for better yield.");
            }
            return new Decision(Recommendation.ACCEPT, String.format(Locale.ROOT,
                    "Acceptable yield (score: %.2f). Consider upsell opportunities.", overallScore));
        } else if (overallScore >= COUNTER_THRESHOLD) {
            return new Decision(Recommendation.COUNTER, String.format(Locale.ROOT,
                    "Below yield threshold (score: %.2f). "
                            + "Counter with terms that improve revenue or relationship value.", overallScore));
        }

        return new Decision(Recommendation.REJECT, String.format(Locale.ROOT,
                "Poor yield opportunity (score: %.2f). Price and/or terms are not acceptable.", overallScore));
    }

    private static boolean isStrategic(AccessTier tier) {
        return tier == AccessTier.AGENCY || tier == AccessTier.ADVERTISER;
    }

    private static boolean containsType(Collection<String> types, String type) {
        return types.stream().anyMatch(candidate -> StringUtils.equalsIgnoreCase(candidate, type));
    }

    private static double toDouble(BigDecimal value) {
        return value != null ? value.doubleValue() : 0.0;
    }

    private record Decision(Recommendation recommendation, String rationale) {
    }
}
