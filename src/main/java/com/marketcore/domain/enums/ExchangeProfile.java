package com.marketcore.domain.enums;

/**
 * The closed set of venue calendars this library knows how to model.
 *
 * <p>Each profile maps to exactly one {@code SecurityExchange} implementation.
 * Adding a venue means adding a constant here and a permitted subclass there.
 */
public enum ExchangeProfile {

    /** Spot currency trading: open around the clock from Sunday 17:00 to Friday 16:00. */
    FOREX
}
