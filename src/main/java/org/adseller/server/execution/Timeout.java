package org.adseller.server.execution;

import lombok.Getter;

import java.time.Clock;

/**
 * Time budget shared by every collaborator call of a single proposal evaluation.
 */
public class Timeout {

    private final Clock clock;

    @Getter
    private final long deadline;

    Timeout(Clock clock, long deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public long remaining() {
        return Math.max(deadline - clock.millis(), 0);
    }

    /**
     * Milliseconds a single collaborator call may take: its own limit, cut down to what is left of the budget.
     */
    public long callBudget(long callTimeout) {
        return Math.max(Math.min(callTimeout, remaining()), 0);
    }
}
