package com.eyelevel.uploadengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only snapshot of a provider's runtime state, as maintained by the health tracker.
 */
@Value
@Builder
public class ProviderStatus {
    String providerId;
    HealthStatus health;
    ConnectionQuality quality;
    long averageResponseTimeMs;
    double successRate;
    long totalAttempts;
    long failedAttempts;
    long bytesTransferred;
    boolean available;
    Instant lastHealthCheck;
}
