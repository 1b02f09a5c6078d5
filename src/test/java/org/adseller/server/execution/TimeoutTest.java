package org.adseller.server.execution;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class TimeoutTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    @Test
    public void callBudgetShouldBeLimitedByCallTimeout() {
        // given
        final Timeout timeout = new TimeoutFactory(CLOCK).create(5000L);

        // when and then
        assertThat(timeout.callBudget(500L)).isEqualTo(500L);
    }

    @Test
    public void callBudgetShouldBeLimitedByRemainingBudget() {
        // given
        final Timeout timeout = new TimeoutFactory(CLOCK).create(300L);

        // when and then
        assertThat(timeout.callBudget(2000L)).isEqualTo(300L);
    }

    @Test
    public void remainingShouldNotGoBelowZero() {
        // given
        final Timeout timeout = new Timeout(CLOCK, CLOCK.millis() - 100L);

        // when and then
        assertThat(timeout.remaining()).isZero();
        assertThat(timeout.callBudget(500L)).isZero();
    }

    @Test
    public void createShouldRejectNonPositiveTimeout() {
        // when and then
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new TimeoutFactory(CLOCK).create(0L))
                .withMessage("Timeout must be positive");
    }
}
