package org.adseller.server.availability;

import io.vertx.core.Future;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfiguredAvailabilitySourceTest {

    private final AvailabilitySource target = new ConfiguredAvailabilitySource(1_000_000L,
            Map.of("ctv-premium", 250_000L));

    @Test
    public void availableImpressionsShouldReturnConfiguredProductVolume() {
        // when
        final Future<Long> result = target.availableImpressions("ctv-premium",
                FlightDates.of(LocalDate.parse("2026-02-01"), LocalDate.parse("2026-02-28")), null);

        // then
        assertThat(result.result()).isEqualTo(250_000L);
    }

    @Test
    public void availableImpressionsShouldFallBackToDefaultVolume() {
        // when
        final Future<Long> result = target.availableImpressions("display-premium", null, null);

        // then
        assertThat(result.result()).isEqualTo(1_000_000L);
    }
}
