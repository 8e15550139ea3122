package com.eyelevel.uploadengine.event;

import com.eyelevel.uploadengine.model.HealthStatus;

/**
 * Published once each time a provider's health classification changes.
 */
public record ProviderHealthChangedEvent(String providerId, HealthStatus previous, HealthStatus current) {
}
