package com.gpuopt.infrastructure.db;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SqlTimeTest {

    @Test
    void formatIsFixedWidthSoTextOrderMatchesTimeOrder() {
        String whole = SqlTime.format(Instant.parse("2024-05-01T10:00:00Z"));
        String fraction = SqlTime.format(Instant.parse("2024-05-01T10:00:00.5Z"));

        assertThat(whole).isEqualTo("2024-05-01T10:00:00.000000Z");
        assertThat(fraction).hasSameSizeAs(whole);
        assertThat(whole.compareTo(fraction)).isNegative();
        assertThat(SqlTime.parse(fraction)).isEqualTo(Instant.parse("2024-05-01T10:00:00.5Z"));
    }

    @Test
    void nullsPassThrough() {
        assertThat(SqlTime.format(null)).isNull();
        assertThat(SqlTime.parse(null)).isNull();
        assertThat(SqlTime.parse(" ")).isNull();
    }
}
