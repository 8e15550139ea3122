package com.eyelevel.uploadengine.dto.report;

import com.eyelevel.uploadengine.model.ConnectionQuality;
import com.eyelevel.uploadengine.model.HealthStatus;

public record ProviderPerformance(String providerId, HealthStatus health, ConnectionQuality quality,
                                  long averageResponseTimeMs, double successRate, long totalAttempts,
                                  long failedAttempts, long bytesTransferred, long selections,
                                  int optimalChunkSizeBytes) {
}
