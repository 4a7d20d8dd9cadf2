package com.fintech.marketfeed.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimestampConverter Tests")
class TimestampConverterTest {

    private static final Instant EXPECTED = Instant.ofEpochMilli(1733740200123L);

    @ParameterizedTest(name = "{0} -> 2024-12-09T10:30:00.123Z")
    @CsvSource({
        "1733740200.123",      // seconds with fraction
        "1733740200123",       // millis
        "1733740200123456",    // micros
        "1733740200123456789"  // nanos
    })
    @DisplayName("Epoch values are scaled by magnitude to milliseconds")
    void testEpochUnits(String epoch) {
        assertThat(TimestampConverter.fromEpoch(new BigDecimal(epoch))).isEqualTo(EXPECTED);
    }

    @Test
    @DisplayName("Should parse ISO-8601 with offset and truncate to millis")
    void testParseIso() {
        assertThat(TimestampConverter.parse("2024-12-09T10:30:00.123456Z")).isEqualTo(EXPECTED);
        assertThat(TimestampConverter.parse("2024-12-09T12:30:00.123+02:00")).isEqualTo(EXPECTED);
    }

    @Test
    @DisplayName("Timestamps without an offset are read as UTC")
    void testParseWithoutOffset() {
        assertThat(TimestampConverter.parse("2024-12-09T10:30:00.123")).isEqualTo(EXPECTED);
    }

    @Test
    @DisplayName("Numeric strings are treated as epoch values")
    void testParseNumericString() {
        assertThat(TimestampConverter.parse(" 1733740200123 ")).isEqualTo(EXPECTED);
    }

    @Test
    @DisplayName("Should format with exactly three fractional digits and Z")
    void testFormat() {
        assertThat(TimestampConverter.format(EXPECTED)).isEqualTo("2024-12-09T10:30:00.123Z");
        assertThat(TimestampConverter.format(Instant.parse("2024-12-09T10:30:00Z"))).isEqualTo("2024-12-09T10:30:00.000Z");
    }

    @Test
    @DisplayName("Should reject garbage and negative epochs")
    void testRejects() {
        assertThatThrownBy(() -> TimestampConverter.parse("yesterday"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimestampConverter.parse("   "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimestampConverter.fromEpoch(new BigDecimal("-1")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
