package com.marketcore.consolidator;

import com.marketcore.domain.model.MarketData;
import com.marketcore.exception.TypeMismatchException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires two consolidators so data flows from the first into the second, and presents
 * the pair as a single consolidator whose output comes from the second.
 *
 * <p>Longer pipelines are built by nesting, e.g.
 * {@code new SequentialConsolidator<>(ticks, new SequentialConsolidator<>(minutes, hours))}.
 * The two stages must agree on the type handed between them; this is checked once, at
 * construction, so the per-value path carries no validation cost.
 *
 * <p>Updates run synchronously: when {@link #update} returns, every value it caused the
 * first stage to produce has already been fed into the second, and every value the second
 * produced has already been announced to this chain's handlers. Failures raised by either
 * stage propagate to the caller unchanged.
 *
 * @param <I> the type consumed by the first stage
 * @param <O> the type produced by the second stage
 */
public class SequentialConsolidator<I extends MarketData, O extends MarketData> implements DataConsolidator<I, O> {

    private static final Logger log = LoggerFactory.getLogger(SequentialConsolidator.class);

    private final DataConsolidator<I, ?> first;
    private final DataConsolidator<?, O> second;
    private final ConsolidatedHandlerRegistry<O> handlers = new ConsolidatedHandlerRegistry<>();

    /**
     * Creates a consolidator that pumps data through {@code first}, then feeds the output
     * of {@code first} into {@code second}.
     *
     * @param first  the consolidator that receives data
     * @param second the consolidator that receives the first one's output
     * @throws TypeMismatchException if the first one's output type is not the second one's input type
     */
    public SequentialConsolidator(DataConsolidator<I, ?> first, DataConsolidator<?, O> second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (!first.getOutputType().equals(second.getInputType())) {
            throw new TypeMismatchException(first.getOutputType(), second.getInputType());
        }
        this.first = first;
        this.second = second;

        second.addConsolidatedHandler((sender, consolidated) -> handlers.fire(this, consolidated));
        forwardOutput(first, second);

        log.debug(
                "Chained {} -> {} ({} -> {})",
                first.getClass().getSimpleName(),
                second.getClass().getSimpleName(),
                getInputType().getSimpleName(),
                getOutputType().getSimpleName());
    }

    public DataConsolidator<I, ?> getFirst() {
        return first;
    }

    public DataConsolidator<?, O> getSecond() {
        return second;
    }

    @Override
    public Class<I> getInputType() {
        return first.getInputType();
    }

    @Override
    public Class<O> getOutputType() {
        return second.getOutputType();
    }

    @Override
    public void update(I data) {
        first.update(data);
    }

    /** Reads through to the second consolidator; the chain keeps no copy of its own. */
    @Override
    public Optional<O> getConsolidated() {
        return second.getConsolidated();
    }

    @Override
    public Subscription addConsolidatedHandler(DataConsolidatedHandler<O> handler) {
        return handlers.add(handler);
    }

    private static <M extends MarketData> void forwardOutput(
            DataConsolidator<?, M> from, DataConsolidator<?, ?> to) {
        from.addConsolidatedHandler((sender, consolidated) -> feed(to, consolidated));
    }

    private static <T extends MarketData> void feed(DataConsolidator<T, ?> target, MarketData data) {
        target.update(target.getInputType().cast(data));
    }
}
