package com.marketcore.exchange;

import com.marketcore.domain.enums.ExchangeProfile;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Spot currency market hours.
 *
 * <pre>
 * Sun 17:00 - Fri 16:00  open, including across midnight
 * Fri 16:00 - Sun 17:00  closed for the weekend
 * </pre>
 *
 * <p>Friday's close is inclusive (16:00:00 is closed) and Sunday's reopening is
 * exclusive (16:59:59 is closed, 17:00:00 is open). Saturday is closed all day.
 */
public final class ForexExchange extends SecurityExchange {

    public static final LocalTime DEFAULT_MARKET_OPEN = LocalTime.MIDNIGHT;

    /** 23.999999 hours: officially there is no close, the market trades over midnight. */
    public static final LocalTime DEFAULT_MARKET_CLOSE = LocalTime.of(23, 59, 59, 996_400_000);

    private static final LocalTime FRIDAY_CLOSE = LocalTime.of(16, 0);
    private static final LocalTime SUNDAY_OPEN = LocalTime.of(17, 0);

    // 365 - Saturdays
    private static final int TRADING_DAYS_PER_YEAR = 313;

    public ForexExchange() {
        super(DEFAULT_MARKET_OPEN, DEFAULT_MARKET_CLOSE);
    }

    @Override
    public ExchangeProfile getProfile() {
        return ExchangeProfile.FOREX;
    }

    @Override
    public boolean isOpen(LocalDateTime dateTime) {
        if (!isTradingDay(dateTime)) {
            return false;
        }

        DayOfWeek dow = dateTime.getDayOfWeek();
        LocalTime timeOfDay = dateTime.toLocalTime();

        if (dow == DayOfWeek.FRIDAY && !timeOfDay.isBefore(FRIDAY_CLOSE)) {
            return false;
        }
        if (dow == DayOfWeek.SUNDAY && timeOfDay.isBefore(SUNDAY_OPEN)) {
            return false;
        }
        return true;
    }

    /** Every day except Saturday is at least partially open. */
    @Override
    public boolean isTradingDay(LocalDateTime dateTime) {
        return dateTime.getDayOfWeek() != DayOfWeek.SATURDAY;
    }

    @Override
    public int getTradingDaysPerYear() {
        return TRADING_DAYS_PER_YEAR;
    }
}
