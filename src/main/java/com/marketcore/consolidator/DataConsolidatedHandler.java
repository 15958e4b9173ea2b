package com.marketcore.consolidator;

import com.marketcore.domain.model.MarketData;

/**
 * Callback invoked when a consolidator produces a new value.
 */
@FunctionalInterface
public interface DataConsolidatedHandler<O extends MarketData> {

    void onDataConsolidated(DataConsolidator<?, O> sender, O consolidated);
}
