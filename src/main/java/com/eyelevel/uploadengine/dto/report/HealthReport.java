package com.eyelevel.uploadengine.dto.report;

import com.eyelevel.uploadengine.model.HealthStatus;
import com.eyelevel.uploadengine.model.ProviderStatus;

import java.time.Instant;
import java.util.List;

/**
 * Fleet-wide health snapshot.
 *
 * @param overallHealth    classification of the fleet by its share of available providers.
 * @param providerCount    number of registered providers.
 * @param healthyProviders number of providers currently OPTIMAL or DEGRADED.
 * @param providers        per-provider statuses, ordered by id.
 * @param generatedAt      when the snapshot was taken.
 */
public record HealthReport(HealthStatus overallHealth, int providerCount, int healthyProviders,
                           List<ProviderStatus> providers, Instant generatedAt) {
}
