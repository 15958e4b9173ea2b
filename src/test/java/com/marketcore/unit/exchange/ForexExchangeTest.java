package com.marketcore.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;

import com.marketcore.domain.enums.ExchangeProfile;
import com.marketcore.exchange.ForexExchange;
import com.marketcore.exchange.SecurityExchange;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for ForexExchange covering the weekend closure boundaries,
 * trading day detection and nominal session defaults.
 */
class ForexExchangeTest {

    // Week of Monday June 9, 2025
    private static final LocalDate MONDAY = LocalDate.of(2025, 6, 9);
    private static final LocalDate THURSDAY = LocalDate.of(2025, 6, 12);
    private static final LocalDate FRIDAY = LocalDate.of(2025, 6, 13);
    private static final LocalDate SATURDAY = LocalDate.of(2025, 6, 14);
    private static final LocalDate SUNDAY = LocalDate.of(2025, 6, 15);

    private ForexExchange forexExchange;

    @BeforeEach
    void setUp() {
        forexExchange = new ForexExchange();
    }

    @Nested
    @DisplayName("Weekend Boundaries")
    class WeekendBoundaries {

        @Test
        @DisplayName("Friday 15:59:59 is open")
        void fridayJustBeforeClose() {
            assertThat(forexExchange.isOpen(FRIDAY.atTime(15, 59, 59))).isTrue();
        }

        @Test
        @DisplayName("Friday 16:00:00 is closed")
        void fridayAtClose() {
            assertThat(forexExchange.isOpen(FRIDAY.atTime(16, 0))).isFalse();
        }

        @Test
        @DisplayName("Friday 23:59:59 is closed")
        void fridayLateNight() {
            assertThat(forexExchange.isOpen(FRIDAY.atTime(23, 59, 59))).isFalse();
        }

        @Test
        @DisplayName("Sunday 16:59:59 is closed")
        void sundayJustBeforeOpen() {
            assertThat(forexExchange.isOpen(SUNDAY.atTime(16, 59, 59))).isFalse();
        }

        @Test
        @DisplayName("Sunday 17:00:00 is open")
        void sundayAtOpen() {
            assertThat(forexExchange.isOpen(SUNDAY.atTime(17, 0))).isTrue();
        }

        @Test
        @DisplayName("Sunday 00:00 is closed")
        void sundayMidnight() {
            assertThat(forexExchange.isOpen(SUNDAY.atStartOfDay())).isFalse();
        }

        @ParameterizedTest(name = "Saturday {0}:00 is closed")
        @ValueSource(ints = {0, 6, 12, 16, 17, 23})
        void saturdayClosedAllDay(int hour) {
            assertThat(forexExchange.isOpen(SATURDAY.atTime(hour, 0))).isFalse();
        }

        @Test
        @DisplayName("Saturday 23:59:59.999 is closed")
        void saturdayLastInstant() {
            assertThat(forexExchange.isOpen(SATURDAY.atTime(LocalTime.MAX))).isFalse();
        }
    }

    @Nested
    @DisplayName("Weekdays")
    class Weekdays {

        @ParameterizedTest(name = "Monday to Thursday open at {0}:00")
        @ValueSource(ints = {0, 1, 9, 15, 16, 17, 23})
        void mondayToThursdayOpen(int hour) {
            for (LocalDate day = MONDAY; !day.isAfter(THURSDAY); day = day.plusDays(1)) {
                assertThat(forexExchange.isOpen(day.atTime(hour, 0))).as(day.getDayOfWeek().name()).isTrue();
            }
        }

        @Test
        @DisplayName("open across midnight between weekdays")
        void openAcrossMidnight() {
            assertThat(forexExchange.isOpen(MONDAY.atTime(LocalTime.MAX))).isTrue();
            assertThat(forexExchange.isOpen(MONDAY.plusDays(1).atStartOfDay())).isTrue();
        }

        @Test
        @DisplayName("Friday morning is open")
        void fridayMorning() {
            assertThat(forexExchange.isOpen(FRIDAY.atTime(9, 0))).isTrue();
        }

        @Test
        @DisplayName("repeated queries return the same answer")
        void queriesAreIdempotent() {
            LocalDateTime closed = FRIDAY.atTime(16, 0);
            LocalDateTime open = SUNDAY.atTime(17, 0);

            for (int i = 0; i < 3; i++) {
                assertThat(forexExchange.isOpen(closed)).isFalse();
                assertThat(forexExchange.isOpen(open)).isTrue();
            }
        }
    }

    @Nested
    @DisplayName("Trading Days")
    class TradingDays {

        @Test
        @DisplayName("Saturday is not a trading day at any time")
        void saturdayNotTradingDay() {
            assertThat(forexExchange.isTradingDay(SATURDAY.atStartOfDay())).isFalse();
            assertThat(forexExchange.isTradingDay(SATURDAY.atTime(12, 0))).isFalse();
            assertThat(forexExchange.isTradingDay(SATURDAY.atTime(LocalTime.MAX))).isFalse();
        }

        @Test
        @DisplayName("every other day is a trading day, even while closed")
        void otherDaysAreTradingDays() {
            for (LocalDate day = MONDAY; day.isBefore(SATURDAY); day = day.plusDays(1)) {
                assertThat(forexExchange.isTradingDay(day.atTime(3, 0))).isTrue();
            }
            assertThat(forexExchange.isTradingDay(FRIDAY.atTime(20, 0))).isTrue();
            assertThat(forexExchange.isTradingDay(SUNDAY.atTime(10, 0))).isTrue();
        }

        @Test
        @DisplayName("next trading day after Friday is Sunday")
        void nextTradingDayAfterFriday() {
            assertThat(forexExchange.getNextTradingDay(FRIDAY)).isEqualTo(SUNDAY);
        }

        @Test
        @DisplayName("previous trading day before Sunday is Friday")
        void previousTradingDayBeforeSunday() {
            assertThat(forexExchange.getPreviousTradingDay(SUNDAY)).isEqualTo(FRIDAY);
        }

        @Test
        @DisplayName("313 trading days per year")
        void tradingDaysPerYear() {
            assertThat(forexExchange.getTradingDaysPerYear()).isEqualTo(313);
        }
    }

    @Nested
    @DisplayName("Nominal Session")
    class NominalSession {

        @Test
        @DisplayName("defaults to the whole day")
        void defaultsToWholeDay() {
            assertThat(forexExchange.getMarketOpen()).isEqualTo(LocalTime.MIDNIGHT);
            assertThat(forexExchange.getMarketClose()).isEqualTo(LocalTime.of(23, 59, 59, 996_400_000));
        }

        @Test
        @DisplayName("changing nominal bounds does not affect isOpen")
        void nominalBoundsDoNotGate() {
            forexExchange.setMarketOpen(LocalTime.of(9, 0));
            forexExchange.setMarketClose(LocalTime.of(10, 0));

            assertThat(forexExchange.getMarketOpen()).isEqualTo(LocalTime.of(9, 0));
            assertThat(forexExchange.getMarketClose()).isEqualTo(LocalTime.of(10, 0));
            assertThat(forexExchange.isOpen(THURSDAY.atTime(20, 0))).isTrue();
            assertThat(forexExchange.isOpen(FRIDAY.atTime(16, 0))).isFalse();
        }
    }

    @Nested
    @DisplayName("Current Time")
    class CurrentTime {

        @Test
        @DisplayName("exchange without a current time reports closed")
        void noCurrentTime() {
            assertThat(forexExchange.getTime()).isNull();
            assertThat(forexExchange.isExchangeOpen()).isFalse();
        }

        @Test
        @DisplayName("isExchangeOpen evaluates the current time")
        void evaluatesCurrentTime() {
            forexExchange.setTime(THURSDAY.atTime(12, 0));
            assertThat(forexExchange.isExchangeOpen()).isTrue();

            forexExchange.setTime(SATURDAY.atTime(12, 0));
            assertThat(forexExchange.isExchangeOpen()).isFalse();
        }
    }

    @Test
    @DisplayName("FOREX profile creates a ForexExchange")
    void createFromProfile() {
        SecurityExchange exchange = SecurityExchange.create(ExchangeProfile.FOREX);

        assertThat(exchange).isInstanceOf(ForexExchange.class);
        assertThat(exchange.getProfile()).isEqualTo(ExchangeProfile.FOREX);
    }
}
