package com.marketcore.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.ToString;

/**
 * A single trade print. The tick's value is its price.
 */
@Getter
@ToString(callSuper = true)
public class Tick extends MarketData {

    private final long quantity;

    public Tick(String symbol, LocalDateTime time, BigDecimal price, long quantity) {
        super(symbol, time, price);
        this.quantity = quantity;
    }

    public BigDecimal getPrice() {
        return getValue();
    }
}
