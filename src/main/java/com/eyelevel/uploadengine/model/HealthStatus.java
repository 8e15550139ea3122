package com.eyelevel.uploadengine.model;

/**
 * Coarse operational state of a provider, derived from its success rate alone.
 * A provider is available for selection only while it is {@link #OPTIMAL} or {@link #DEGRADED}.
 */
public enum HealthStatus {
    OPTIMAL,
    DEGRADED,
    CRITICAL,
    OFFLINE;

    /**
     * Classifies a success rate (0-100). Boundaries are exclusive: exactly 90% is DEGRADED,
     * exactly 50% is OFFLINE.
     *
     * @param successRate the percentage of successful attempts.
     * @return the matching classification.
     */
    public static HealthStatus fromSuccessRate(final double successRate) {
        if (successRate > 90.0) {
            return OPTIMAL;
        } else if (successRate > 70.0) {
            return DEGRADED;
        } else if (successRate > 50.0) {
            return CRITICAL;
        }
        return OFFLINE;
    }

    /**
     * Classifies the share of healthy providers in the whole fleet.
     *
     * @param healthyCount number of providers that are currently healthy.
     * @param totalCount   number of registered providers.
     * @return OFFLINE when there are no providers at all.
     */
    public static HealthStatus fromHealthyRatio(final int healthyCount, final int totalCount) {
        if (totalCount == 0) {
            return OFFLINE;
        }
        final double ratio = (double) healthyCount / totalCount;
        if (ratio >= 0.8) {
            return OPTIMAL;
        } else if (ratio >= 0.5) {
            return DEGRADED;
        } else if (ratio > 0) {
            return CRITICAL;
        }
        return OFFLINE;
    }

    public boolean isAvailable() {
        return this == OPTIMAL || this == DEGRADED;
    }
}
