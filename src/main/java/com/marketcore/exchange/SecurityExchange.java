package com.marketcore.exchange;

import com.marketcore.domain.enums.ExchangeProfile;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Trading calendar of a single venue: decides whether the market is open at a given
 * venue-local time, and carries the venue's nominal session bounds.
 *
 * <p>The open/closed decision is a pure function of the instant and is re-evaluated on
 * every query. {@link #getMarketOpen()} and {@link #getMarketClose()} are advisory
 * session markers only; {@link #isOpen(LocalDateTime)} never consults them.
 *
 * <p>The set of venues is closed: each {@link ExchangeProfile} has exactly one permitted
 * subclass, created through {@link #create(ExchangeProfile)}.
 *
 * <p>Not thread-safe for writers. Concurrent queries are safe as long as the current
 * time and nominal session fields are not being written at the same time.
 */
public abstract sealed class SecurityExchange permits ForexExchange {

    private LocalDateTime time;
    private LocalTime marketOpen;
    private LocalTime marketClose;

    protected SecurityExchange(LocalTime marketOpen, LocalTime marketClose) {
        this.marketOpen = marketOpen;
        this.marketClose = marketClose;
    }

    /** Creates the calendar for the given venue profile. */
    public static SecurityExchange create(ExchangeProfile profile) {
        Objects.requireNonNull(profile, "profile");
        return switch (profile) {
            case FOREX -> new ForexExchange();
        };
    }

    public abstract ExchangeProfile getProfile();

    /**
     * Returns true if the market is open at the given venue-local time.
     */
    public abstract boolean isOpen(LocalDateTime dateTime);

    /**
     * Returns true if the calendar date of {@code dateTime} is a trading day at all,
     * regardless of the time of day.
     */
    public abstract boolean isTradingDay(LocalDateTime dateTime);

    /** Number of trading days per year, used for annualizing performance statistics. */
    public abstract int getTradingDaysPerYear();

    /**
     * Returns true if the market is open at the current time set by the owning context.
     * A calendar whose current time was never set reports closed.
     */
    public boolean isExchangeOpen() {
        return time != null && isOpen(time);
    }

    /** Returns the first trading day strictly after {@code from}. */
    public LocalDate getNextTradingDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isTradingDay(next.atStartOfDay())) {
            next = next.plusDays(1);
        }
        return next;
    }

    /** Returns the last trading day strictly before {@code from}. */
    public LocalDate getPreviousTradingDay(LocalDate from) {
        LocalDate prev = from.minusDays(1);
        while (!isTradingDay(prev.atStartOfDay())) {
            prev = prev.minusDays(1);
        }
        return prev;
    }

    public LocalDateTime getTime() {
        return time;
    }

    public void setTime(LocalDateTime time) {
        this.time = time;
    }

    public LocalTime getMarketOpen() {
        return marketOpen;
    }

    public void setMarketOpen(LocalTime marketOpen) {
        this.marketOpen = marketOpen;
    }

    public LocalTime getMarketClose() {
        return marketClose;
    }

    public void setMarketClose(LocalTime marketClose) {
        this.marketClose = marketClose;
    }
}
