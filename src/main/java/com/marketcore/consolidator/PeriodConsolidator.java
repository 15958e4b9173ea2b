package com.marketcore.consolidator;

import com.marketcore.domain.model.MarketData;
import com.marketcore.domain.model.TradeBar;
import com.marketcore.exception.InvalidConfigurationException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates input data into {@link TradeBar}s of a fixed period.
 *
 * <p>Bars are aligned to multiples of the period counted from midnight, so a one-minute
 * consolidator always produces bars starting at {@code hh:mm:00}. The working bar is
 * emitted when data for a later period arrives, or when {@link #scan} is called with a
 * time at or past the bar's end. An input belonging to a period earlier than the working
 * bar is logged and dropped.
 *
 * @param <I> the type consumed
 */
public abstract class PeriodConsolidator<I extends MarketData> extends AbstractDataConsolidator<I, TradeBar> {

    private static final Logger log = LoggerFactory.getLogger(PeriodConsolidator.class);

    private static final long NANOS_PER_DAY = Duration.ofDays(1).toNanos();

    private final Duration period;
    private TradeBar workingBar;

    protected PeriodConsolidator(Class<I> inputType, Duration period) {
        super(inputType, TradeBar.class);
        Objects.requireNonNull(period, "period");
        if (period.isZero()
                || period.isNegative()
                || period.compareTo(Duration.ofDays(1)) > 0
                || NANOS_PER_DAY % period.toNanos() != 0) {
            throw new InvalidConfigurationException(
                    "Consolidation period must be positive and divide a day evenly: " + period,
                    Map.of("period", period.toString()));
        }
        this.period = period;
    }

    public Duration getPeriod() {
        return period;
    }

    /** Returns the bar currently being built, if any data has arrived since the last emission. */
    public Optional<TradeBar> getWorkingBar() {
        return Optional.ofNullable(workingBar);
    }

    @Override
    public void update(I data) {
        Objects.requireNonNull(data, "data");
        LocalDateTime periodStart = roundDown(data.getTime());

        if (workingBar != null) {
            if (periodStart.isBefore(workingBar.getTime())) {
                log.warn(
                        "Dropping out-of-order {} for {} at {}: working bar started at {}",
                        data.getClass().getSimpleName(),
                        data.getSymbol(),
                        data.getTime(),
                        workingBar.getTime());
                return;
            }
            if (!periodStart.isBefore(workingBar.getEndTime())) {
                // the next bar must hold this input before any handler runs
                TradeBar completed = workingBar;
                workingBar = createBar(data, periodStart);
                emit(completed);
                return;
            }
            aggregate(workingBar, data);
            return;
        }

        workingBar = createBar(data, periodStart);
    }

    /**
     * Emits the working bar if {@code currentTime} has reached its end time. Lets a
     * caller flush a bar for a quiet market without waiting for the next input.
     *
     * @param currentTime the current venue-local time
     */
    public void scan(LocalDateTime currentTime) {
        if (workingBar != null && !currentTime.isBefore(workingBar.getEndTime())) {
            TradeBar completed = workingBar;
            workingBar = null;
            emit(completed);
        }
    }

    /** Opens a new working bar for the period starting at {@code periodStart}. */
    protected abstract TradeBar createBar(I data, LocalDateTime periodStart);

    /** Folds {@code data} into the working bar. */
    protected abstract void aggregate(TradeBar workingBar, I data);

    private LocalDateTime roundDown(LocalDateTime time) {
        LocalDateTime startOfDay = time.toLocalDate().atStartOfDay();
        long nanosIntoDay = Duration.between(startOfDay, time).toNanos();
        return startOfDay.plusNanos(nanosIntoDay - nanosIntoDay % period.toNanos());
    }

    private void emit(TradeBar completed) {
        log.debug(
                "Bar completed for {} at {} [O={} H={} L={} C={} V={}]",
                completed.getSymbol(),
                completed.getTime(),
                completed.getOpen(),
                completed.getHigh(),
                completed.getLow(),
                completed.getClose(),
                completed.getVolume());

        onDataConsolidated(completed);
    }
}
