package org.adseller.server.yield.model;

import lombok.Value;
import org.adseller.server.exception.InvalidConfigurationException;

@Value(staticConstructor = "of")
public class YieldWeights {

    private static final double SUM_TOLERANCE = 1e-6;

    private static final YieldWeights DEFAULT = YieldWeights.of(0.4, 0.3, 0.2, 0.1);

    double revenue;

    double relationship;

    double fillRate;

    double pricingPower;

    public static YieldWeights defaultWeights() {
        return DEFAULT;
    }

    public YieldWeights validate() {
        if (revenue < 0 || relationship < 0 || fillRate < 0 || pricingPower < 0) {
            throw new InvalidConfigurationException("Yield weights must be non-negative, but were " + this);
        }

        final double sum = revenue + relationship + fillRate + pricingPower;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidConfigurationException("Yield weights must sum to 1, but sum was " + sum);
        }
        return this;
    }
}
