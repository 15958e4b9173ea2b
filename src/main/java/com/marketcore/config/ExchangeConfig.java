package com.marketcore.config;

import com.marketcore.domain.enums.ExchangeProfile;
import com.marketcore.exception.InvalidConfigurationException;
import com.marketcore.exchange.ExchangeHoursConfig;
import com.marketcore.exchange.SecurityExchange;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the forex {@link SecurityExchange} bean with nominal session bounds from
 * application.yml.
 *
 * <p>Properties prefix: {@code market-core.exchange.forex.*}
 */
@Configuration
@EnableConfigurationProperties(ExchangeHoursConfig.class)
public class ExchangeConfig {

    private static final Logger log = LoggerFactory.getLogger(ExchangeConfig.class);

    @Bean
    public SecurityExchange forexExchange(ExchangeHoursConfig exchangeHoursConfig) {
        SecurityExchange exchange = SecurityExchange.create(ExchangeProfile.FOREX);
        exchange.setMarketOpen(parseTime("market-open", exchangeHoursConfig.getMarketOpen()));
        exchange.setMarketClose(parseTime("market-close", exchangeHoursConfig.getMarketClose()));

        log.info(
                "{} exchange configured: nominal session {} - {}",
                exchange.getProfile(),
                exchange.getMarketOpen(),
                exchange.getMarketClose());
        return exchange;
    }

    private static LocalTime parseTime(String property, String value) {
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException(
                    "Invalid time for market-core.exchange.forex." + property + ": " + value,
                    Map.of("property", property, "value", String.valueOf(value)),
                    e);
        }
    }
}
