package com.marketcore.consolidator;

import com.marketcore.domain.model.TradeBar;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Rolls shorter trade bars up into bars of a longer, fixed period.
 *
 * <p>Input bars are assigned to an output period by their start time.
 */
public class TradeBarConsolidator extends PeriodConsolidator<TradeBar> {

    public TradeBarConsolidator(Duration period) {
        super(TradeBar.class, period);
    }

    @Override
    protected TradeBar createBar(TradeBar bar, LocalDateTime periodStart) {
        return new TradeBar(
                bar.getSymbol(),
                periodStart,
                getPeriod(),
                bar.getOpen(),
                bar.getHigh(),
                bar.getLow(),
                bar.getClose(),
                bar.getVolume());
    }

    @Override
    protected void aggregate(TradeBar workingBar, TradeBar bar) {
        workingBar.update(bar);
    }
}
