package com.marketcore.exchange;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Nominal session bounds for the forex calendar, bound from the
 * {@code market-core.exchange.forex} prefix.
 *
 * <p>Times are ISO local times ({@code "00:00"}, {@code "23:59:59.9964"}). They are
 * advisory only and never gate the open/closed decision.
 */
@ConfigurationProperties(prefix = "market-core.exchange.forex")
public class ExchangeHoursConfig {

    private String marketOpen = ForexExchange.DEFAULT_MARKET_OPEN.toString();
    private String marketClose = ForexExchange.DEFAULT_MARKET_CLOSE.toString();

    public String getMarketOpen() {
        return marketOpen;
    }

    public void setMarketOpen(String marketOpen) {
        this.marketOpen = marketOpen;
    }

    public String getMarketClose() {
        return marketClose;
    }

    public void setMarketClose(String marketClose) {
        this.marketClose = marketClose;
    }
}
