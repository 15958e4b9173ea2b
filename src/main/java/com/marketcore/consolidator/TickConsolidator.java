package com.marketcore.consolidator;

import com.marketcore.domain.model.Tick;
import com.marketcore.domain.model.TradeBar;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Builds trade bars of a fixed period from individual ticks.
 */
public class TickConsolidator extends PeriodConsolidator<Tick> {

    public TickConsolidator(Duration period) {
        super(Tick.class, period);
    }

    @Override
    protected TradeBar createBar(Tick tick, LocalDateTime periodStart) {
        return new TradeBar(
                tick.getSymbol(),
                periodStart,
                getPeriod(),
                tick.getPrice(),
                tick.getPrice(),
                tick.getPrice(),
                tick.getPrice(),
                tick.getQuantity());
    }

    @Override
    protected void aggregate(TradeBar workingBar, Tick tick) {
        workingBar.update(tick.getPrice(), tick.getQuantity());
    }
}
