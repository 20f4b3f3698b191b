package com.aiide.backbone.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ManualTickerTest {

    @Test
    void shouldStartAtGivenValue() {
        assertThat(new ManualTicker(42).nanos()).isEqualTo(42);
        assertThat(new ManualTicker().nanos()).isZero();
    }

    @Test
    void shouldAdvance() {
        ManualTicker ticker = new ManualTicker();
        ticker.advance(Duration.ofMillis(5)).advanceMillis(10);

        assertThat(ticker.nanos()).isEqualTo(Duration.ofMillis(15).toNanos());
    }

    @Test
    void shouldRejectNegativeAdvance() {
        assertThatThrownBy(() -> new ManualTicker().advance(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
