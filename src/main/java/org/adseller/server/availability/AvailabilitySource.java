package org.adseller.server.availability;

import io.vertx.core.Future;
import org.adseller.server.execution.Timeout;

/**
 * Reports how many impressions of a product can still be sold over a flight.
 */
public interface AvailabilitySource {

    Future<Long> availableImpressions(String productId, FlightDates flight, Timeout timeout);
}
