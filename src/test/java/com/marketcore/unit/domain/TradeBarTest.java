package com.marketcore.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.marketcore.domain.model.MarketData;
import com.marketcore.domain.model.Tick;
import com.marketcore.domain.model.TradeBar;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for TradeBar accumulation and the immutability of shared market data fields.
 */
class TradeBarTest {

    private static final LocalDateTime BASE_TIME = LocalDateTime.of(2025, 6, 11, 9, 0, 0);

    @Test
    @DisplayName("value tracks close through price and bar updates")
    void valueTracksClose() {
        BigDecimal one = BigDecimal.ONE;
        TradeBar bar = new TradeBar("EURUSD", BASE_TIME, Duration.ofMinutes(1), one, one, one, one, 1);

        bar.update(new BigDecimal("1.5"), 10);
        assertThat(bar.getValue()).isEqualByComparingTo(bar.getClose()).isEqualByComparingTo("1.5");

        bar.update(new TradeBar(
                "EURUSD",
                BASE_TIME,
                Duration.ofSeconds(1),
                new BigDecimal("1.4"),
                new BigDecimal("1.6"),
                new BigDecimal("0.9"),
                new BigDecimal("1.2"),
                5));
        assertThat(bar.getValue()).isEqualByComparingTo(bar.getClose()).isEqualByComparingTo("1.2");
        assertThat(bar.getHigh()).isEqualByComparingTo("1.6");
        assertThat(bar.getLow()).isEqualByComparingTo("0.9");
        assertThat(bar.getVolume()).isEqualTo(16);
    }

    @Test
    @DisplayName("symbol, time and value have no public setters")
    void noPublicSetters() {
        for (Class<?> type : new Class<?>[] {MarketData.class, Tick.class, TradeBar.class}) {
            assertThat(Arrays.stream(type.getMethods())
                            .filter(method -> Modifier.isPublic(method.getModifiers()))
                            .map(Method::getName))
                    .as(type.getSimpleName())
                    .doesNotContain("setSymbol", "setTime", "setValue");
        }
    }
}
