package com.eyelevel.uploadengine.event;

import com.eyelevel.uploadengine.model.HealthStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Default subscriber for engine notifications. Alerting integrations can listen to the same
 * events alongside it.
 */
@Slf4j
@Component
public class UploadEventLogger {

    @EventListener
    public void onHealthChanged(final ProviderHealthChangedEvent event) {
        if (event.current() == HealthStatus.OFFLINE || event.current() == HealthStatus.CRITICAL) {
            log.warn("Provider '{}' health changed: {} -> {}", event.providerId(), event.previous(), event.current());
        } else {
            log.info("Provider '{}' health changed: {} -> {}", event.providerId(), event.previous(), event.current());
        }
    }

    @EventListener
    public void onFailover(final ProviderFailoverEvent event) {
        log.warn("Failover from provider '{}' to '{}' (request: {})", event.fromProviderId(), event.toProviderId(),
                event.requestId() != null ? event.requestId() : "manual");
    }

    @EventListener
    public void onCostThresholdExceeded(final CostThresholdExceededEvent event) {
        log.warn("Monthly upload spend {} exceeds budget {}", String.format("%.4f", event.currentSpend()),
                String.format("%.2f", event.budget()));
    }
}
