package com.marketcore.event;

import com.marketcore.domain.enums.ExchangeProfile;
import com.marketcore.domain.enums.ExchangeStatus;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a venue transitions between OPEN and CLOSED.
 *
 * <p>Transitions are detected by the ExchangeHoursMonitor as the owning context advances
 * the exchange's current time. {@code transitionTime} is the venue-local time at which the
 * new status was first observed, not the wall-clock time of publication.
 */
public class ExchangeStatusEvent extends ApplicationEvent {

    private final ExchangeProfile profile;
    private final ExchangeStatus previousStatus;
    private final ExchangeStatus currentStatus;
    private final LocalDateTime transitionTime;

    public ExchangeStatusEvent(
            Object source,
            ExchangeProfile profile,
            ExchangeStatus previousStatus,
            ExchangeStatus currentStatus,
            LocalDateTime transitionTime) {
        super(source);
        this.profile = profile;
        this.previousStatus = previousStatus;
        this.currentStatus = currentStatus;
        this.transitionTime = transitionTime;
    }

    public ExchangeProfile getProfile() {
        return profile;
    }

    public ExchangeStatus getPreviousStatus() {
        return previousStatus;
    }

    public ExchangeStatus getCurrentStatus() {
        return currentStatus;
    }

    public LocalDateTime getTransitionTime() {
        return transitionTime;
    }
}
