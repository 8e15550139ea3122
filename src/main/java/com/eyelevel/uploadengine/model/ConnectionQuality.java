package com.eyelevel.uploadengine.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Descriptive rating of a provider link. It never influences health or availability;
 * it only drives reporting and the suggested chunk size for that provider.
 */
@Getter
@AllArgsConstructor
public enum ConnectionQuality {
    EXCELLENT(1024 * 1024),
    GOOD(512 * 1024),
    FAIR(256 * 1024),
    POOR(128 * 1024);

    private final int optimalChunkSizeBytes;

    public static ConnectionQuality assess(final long averageResponseTimeMs, final double successRate) {
        if (averageResponseTimeMs < 100 && successRate > 95.0) {
            return EXCELLENT;
        } else if (averageResponseTimeMs < 200 && successRate > 90.0) {
            return GOOD;
        } else if (averageResponseTimeMs < 500 && successRate > 80.0) {
            return FAIR;
        }
        return POOR;
    }
}
