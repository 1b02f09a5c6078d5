package org.adseller.server.execution;

import java.time.Clock;
import java.util.Objects;

public class TimeoutFactory {

    private final Clock clock;

    public TimeoutFactory(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Returns a {@link Timeout} expiring after the given amount of milliseconds from now.
     */
    public Timeout create(long timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("Timeout must be positive");
        }

        return new Timeout(clock, clock.millis() + timeout);
    }
}
