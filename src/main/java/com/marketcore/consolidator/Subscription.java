package com.marketcore.consolidator;

/**
 * Handle to a registered {@link DataConsolidatedHandler}. Cancelling more than once is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
