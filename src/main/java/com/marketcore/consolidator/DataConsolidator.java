package com.marketcore.consolidator;

import com.marketcore.domain.model.MarketData;
import java.util.Optional;

/**
 * A single stream-transformation stage: consumes values of one type and, from time to
 * time, produces a value of another.
 *
 * <p>Every production is stored as the most recently consolidated value and then
 * announced to registered handlers. Announcements happen inline, on the caller's thread,
 * before {@link #update} returns. Implementations are not thread-safe: callers feeding a
 * consolidator from several threads must serialize access themselves.
 *
 * @param <I> the type consumed
 * @param <O> the type produced
 */
public interface DataConsolidator<I extends MarketData, O extends MarketData> {

    /** Type tag of the data this consolidator consumes. */
    Class<I> getInputType();

    /** Type tag of the data this consolidator produces. */
    Class<O> getOutputType();

    /**
     * Feeds one value into this consolidator.
     *
     * @param data the new data, never null
     */
    void update(I data);

    /** Returns the most recently produced value, or empty if nothing has been produced yet. */
    Optional<O> getConsolidated();

    /**
     * Registers a handler that is invoked every time this consolidator produces a value.
     *
     * @param handler the handler to invoke
     * @return a handle that removes the handler when cancelled
     */
    Subscription addConsolidatedHandler(DataConsolidatedHandler<O> handler);
}
