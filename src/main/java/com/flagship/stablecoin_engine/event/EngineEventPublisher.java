package com.flagship.stablecoin_engine.event;

import com.flagship.stablecoin_engine.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

/**
 * Hands committed events to in-process listeners.
 *
 * Called only after the ledger transaction that recorded the events has
 * committed, so listeners never see facts that were rolled back. The
 * operation has already succeeded at this point; a failing listener is
 * logged and counted but does not fail the caller.
 */
@Slf4j
@RequiredArgsConstructor
public class EngineEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final EngineMetrics metrics;

    public void publish(List<EngineEvent> events) {
        for (EngineEvent event : events) {
            try {
                applicationEventPublisher.publishEvent(event);
                metrics.recordEventPublished(event.getEventType());
            } catch (RuntimeException e) {
                log.error("Event listener failed: eventId={}, eventType={}, account={}, error={}",
                    event.getEventId(), event.getEventType(), event.getAccount(), e.getMessage(), e);
                metrics.recordEventPublishFailure(event.getEventType(), "application");
            }
        }
    }
}
