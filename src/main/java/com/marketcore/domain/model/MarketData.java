package com.marketcore.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Base type for every value that flows through a consolidator.
 *
 * <p>{@code time} is the start of the period the value covers, in venue-local time.
 * Point-in-time data (ticks) covers no period, so its end time equals its start time.
 * Symbol and time are fixed at construction; only subclasses may move the value.
 */
@Getter
@ToString
public abstract class MarketData {

    private final String symbol;
    private final LocalDateTime time;

    @Setter(AccessLevel.PROTECTED)
    private BigDecimal value;

    protected MarketData(String symbol, LocalDateTime time, BigDecimal value) {
        this.symbol = symbol;
        this.time = Objects.requireNonNull(time, "time");
        this.value = value;
    }

    /** Returns the moment this value stops being current. */
    public LocalDateTime getEndTime() {
        return time;
    }
}
