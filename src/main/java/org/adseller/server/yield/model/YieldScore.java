package org.adseller.server.yield.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class YieldScore {

    double overallScore;

    double revenueScore;

    double relationshipScore;

    double fillRateImpact;

    double pricingPowerImpact;

    Recommendation recommendation;

    String rationale;
}
