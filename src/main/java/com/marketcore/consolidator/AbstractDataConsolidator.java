package com.marketcore.consolidator;

import com.marketcore.domain.model.MarketData;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for single-stage consolidators: holds the type tags, the handler registry
 * and the most recently consolidated value.
 */
public abstract class AbstractDataConsolidator<I extends MarketData, O extends MarketData>
        implements DataConsolidator<I, O> {

    private final Class<I> inputType;
    private final Class<O> outputType;
    private final ConsolidatedHandlerRegistry<O> handlers = new ConsolidatedHandlerRegistry<>();
    private O consolidated;

    protected AbstractDataConsolidator(Class<I> inputType, Class<O> outputType) {
        this.inputType = Objects.requireNonNull(inputType, "inputType");
        this.outputType = Objects.requireNonNull(outputType, "outputType");
    }

    @Override
    public Class<I> getInputType() {
        return inputType;
    }

    @Override
    public Class<O> getOutputType() {
        return outputType;
    }

    @Override
    public Optional<O> getConsolidated() {
        return Optional.ofNullable(consolidated);
    }

    @Override
    public Subscription addConsolidatedHandler(DataConsolidatedHandler<O> handler) {
        return handlers.add(handler);
    }

    /** Number of handlers currently registered. */
    public int getHandlerCount() {
        return handlers.size();
    }

    /**
     * Records {@code data} as the latest output and notifies every handler.
     * The value is stored before handlers run, so they observe it via {@link #getConsolidated()}.
     */
    protected void onDataConsolidated(O data) {
        consolidated = data;
        handlers.fire(this, data);
    }
}
