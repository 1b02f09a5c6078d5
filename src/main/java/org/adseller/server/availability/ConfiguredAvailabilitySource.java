package org.adseller.server.availability;

import io.vertx.core.Future;
import org.adseller.server.execution.Timeout;

import java.util.Map;
import java.util.Objects;

/**
 * {@link AvailabilitySource} answering from statically configured per-product volumes.
 */
public class ConfiguredAvailabilitySource implements AvailabilitySource {

    private final long defaultImpressions;
    private final Map<String, Long> productImpressions;

    public ConfiguredAvailabilitySource(long defaultImpressions, Map<String, Long> productImpressions) {
        this.defaultImpressions = defaultImpressions;
        this.productImpressions = Objects.requireNonNull(productImpressions);
    }

    @Override
    public Future<Long> availableImpressions(String productId, FlightDates flight, Timeout timeout) {
        return Future.succeededFuture(productImpressions.getOrDefault(productId, defaultImpressions));
    }
}
