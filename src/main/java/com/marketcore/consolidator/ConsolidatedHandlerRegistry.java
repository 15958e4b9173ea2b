package com.marketcore.consolidator;

import com.marketcore.domain.model.MarketData;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The "produced" notification channel of a consolidator.
 *
 * <p>Handlers are invoked synchronously in registration order. The backing list is
 * copy-on-write, so a handler may cancel its own subscription (or register a new one)
 * while it is being notified; the change applies from the next notification.
 */
final class ConsolidatedHandlerRegistry<O extends MarketData> {

    private final List<DataConsolidatedHandler<O>> handlers = new CopyOnWriteArrayList<>();

    Subscription add(DataConsolidatedHandler<O> handler) {
        Objects.requireNonNull(handler, "handler");
        Registration registration = new Registration(handler);
        handlers.add(registration);
        return registration;
    }

    void fire(DataConsolidator<?, O> sender, O consolidated) {
        for (DataConsolidatedHandler<O> handler : handlers) {
            handler.onDataConsolidated(sender, consolidated);
        }
    }

    int size() {
        return handlers.size();
    }

    /** Wraps each handler so that registering the same handler twice yields two independent handles. */
    private final class Registration implements DataConsolidatedHandler<O>, Subscription {

        private final DataConsolidatedHandler<O> delegate;

        private Registration(DataConsolidatedHandler<O> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onDataConsolidated(DataConsolidator<?, O> sender, O consolidated) {
            delegate.onDataConsolidated(sender, consolidated);
        }

        @Override
        public void cancel() {
            handlers.remove(this);
        }
    }
}
