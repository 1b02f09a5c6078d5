package org.adseller.server.identity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class UUIDIdGeneratorTest {

    @Test
    public void generateIdShouldReturnDistinctHexIds() {
        // given
        final IdGenerator target = new UUIDIdGenerator();

        // when
        final String first = target.generateId();
        final String second = target.generateId();

        // then
        assertThat(first).matches("[0-9a-f]{32}");
        assertThat(first).isNotEqualTo(second);
    }
}
