package org.adseller.server.yield.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

@Value
@Builder
public class YieldRecommendation {

    YieldAction action;

    double confidence;

    String rationale;

    CounterTerms counterTerms;

    @Builder.Default
    List<UpsellSuggestion> upsellOpportunities = Collections.emptyList();
}
