package com.eyelevel.uploadengine.model;

import java.util.List;

/**
 * Result of an upload handed to the failover coordinator.
 *
 * @param requestId           the request this result belongs to.
 * @param status              final status.
 * @param providerId          provider that accepted the upload, {@code null} when none did.
 * @param attemptedProviders  providers tried, in order; never contains duplicates.
 */
public record UploadResult(String requestId, UploadStatus status, String providerId, List<String> attemptedProviders) {

    public UploadResult {
        attemptedProviders = List.copyOf(attemptedProviders);
    }

    public static UploadResult noProviderAvailable(final String requestId) {
        return new UploadResult(requestId, UploadStatus.NO_PROVIDER_AVAILABLE, null, List.of());
    }

    public boolean isSuccessful() {
        return status.isSuccessful();
    }
}
