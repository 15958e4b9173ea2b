package com.marketcore.exchange;

import com.marketcore.domain.enums.ExchangeStatus;
import com.marketcore.event.ExchangeStatusEvent;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Advances the current time of a {@link SecurityExchange} and publishes an
 * {@link ExchangeStatusEvent} whenever the venue opens or closes.
 *
 * <p>The time frontier is driven by the data itself (typically the end time of each
 * consolidated bar), so no wall clock or timezone is involved. The first frontier only
 * establishes the initial status; events are published on subsequent changes.
 */
@Service
public class ExchangeHoursMonitor {

    private static final Logger log = LoggerFactory.getLogger(ExchangeHoursMonitor.class);

    private final SecurityExchange securityExchange;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final AtomicReference<ExchangeStatus> currentStatus = new AtomicReference<>();

    public ExchangeHoursMonitor(
            SecurityExchange securityExchange, ApplicationEventPublisher applicationEventPublisher) {
        this.securityExchange = securityExchange;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Sets the exchange's current time and re-evaluates its status.
     *
     * @param localTime the new venue-local time
     */
    public void setLocalDateTimeFrontier(LocalDateTime localTime) {
        Objects.requireNonNull(localTime, "localTime");
        securityExchange.setTime(localTime);

        ExchangeStatus newStatus = securityExchange.isExchangeOpen() ? ExchangeStatus.OPEN : ExchangeStatus.CLOSED;
        ExchangeStatus previousStatus = currentStatus.getAndSet(newStatus);

        if (previousStatus != null && previousStatus != newStatus) {
            log.info(
                    "{} exchange status transition at {}: {} -> {}",
                    securityExchange.getProfile(),
                    localTime,
                    previousStatus,
                    newStatus);
            applicationEventPublisher.publishEvent(new ExchangeStatusEvent(
                    this, securityExchange.getProfile(), previousStatus, newStatus, localTime));
        }
    }

    /** Returns the last observed status, or empty before the first frontier. */
    public Optional<ExchangeStatus> getCurrentStatus() {
        return Optional.ofNullable(currentStatus.get());
    }

    public SecurityExchange getSecurityExchange() {
        return securityExchange;
    }
}
