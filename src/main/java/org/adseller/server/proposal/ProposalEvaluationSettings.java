package org.adseller.server.proposal;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Time budget and market inputs of proposal evaluation.
 */
@Value
@Builder
public class ProposalEvaluationSettings {

    @Builder.Default
    long evaluationTimeoutMs = 5000L;

    @Builder.Default
    long embeddingTimeoutMs = 1000L;

    @Builder.Default
    long availabilityTimeoutMs = 500L;

    @Builder.Default
    long advisorTimeoutMs = 2000L;

    @Builder.Default
    long persistenceTimeoutMs = 500L;

    /**
     * Current sell-through of the seller's inventory, fed into yield scoring.
     */
    @Builder.Default
    double currentFillRate = 0.75;

    @Builder.Default
    BigDecimal defaultMarketCpm = BigDecimal.valueOf(15);

    @Builder.Default
    Map<String, BigDecimal> marketCpmByInventoryType = Collections.emptyMap();

    public BigDecimal marketCpm(String inventoryType) {
        final BigDecimal marketCpm = StringUtils.isNotBlank(inventoryType)
                ? MapUtils.emptyIfNull(marketCpmByInventoryType).get(inventoryType.toLowerCase(Locale.ROOT))
                : null;
        return marketCpm != null ? marketCpm : defaultMarketCpm;
    }
}
