package com.marketcore.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.ToString;

/**
 * OHLCV bar covering {@code [time, time + period)}.
 *
 * <p>A bar is mutable while it is the working bar of a consolidator: prices and bars
 * are folded into it until the period elapses. Its value always tracks the close.
 *
 * <p>Thread safety: a working bar is only touched by the consolidator that owns it,
 * so no internal synchronization is needed.
 */
@Getter
@ToString(callSuper = true)
public class TradeBar extends MarketData {

    private final Duration period;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private long volume;

    public TradeBar(
            String symbol,
            LocalDateTime time,
            Duration period,
            BigDecimal open,
            BigDecimal high,
            BigDecimal low,
            BigDecimal close,
            long volume) {
        super(symbol, time, close);
        this.period = period;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    @Override
    public LocalDateTime getEndTime() {
        return getTime().plus(period);
    }

    /**
     * Folds a traded price into this bar.
     *
     * @param price  the traded price
     * @param volume the traded quantity
     */
    public void update(BigDecimal price, long volume) {
        if (price.compareTo(high) > 0) {
            high = price;
        }
        if (price.compareTo(low) < 0) {
            low = price;
        }
        setClose(price);
        this.volume += volume;
    }

    /**
     * Folds a shorter bar into this one. The open is left untouched since it belongs
     * to the first bar of the period.
     */
    public void update(TradeBar bar) {
        if (bar.getHigh().compareTo(high) > 0) {
            high = bar.getHigh();
        }
        if (bar.getLow().compareTo(low) < 0) {
            low = bar.getLow();
        }
        setClose(bar.getClose());
        this.volume += bar.getVolume();
    }

    private void setClose(BigDecimal close) {
        this.close = close;
        setValue(close);
    }
}
