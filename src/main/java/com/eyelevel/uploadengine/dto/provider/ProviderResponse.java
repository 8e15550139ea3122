package com.eyelevel.uploadengine.dto.provider;

import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.ProviderPlatform;
import com.eyelevel.uploadengine.model.ProviderStatus;
import com.eyelevel.uploadengine.model.SyncMode;

/**
 * A provider as exposed over HTTP. Credentials are never included.
 *
 * @param status runtime state, {@code null} if the provider is no longer tracked.
 */
public record ProviderResponse(String id, ProviderPlatform platform, int priority, String endpoint, String region,
                               String bucketName, boolean encryptedTransport, SyncMode syncMode,
                               Double costPerMegabyte, ProviderStatus status) {

    public static ProviderResponse from(final Provider provider, final ProviderStatus status) {
        return new ProviderResponse(provider.getId(), provider.getPlatform(), provider.getPriority(),
                provider.getConfig().getEndpoint(), provider.getConfig().getRegion(),
                provider.getConfig().getBucketName(), provider.getConfig().isEncryptedTransport(),
                provider.getConfig().getSyncMode(), provider.getConfig().getCostPerMegabyte(), status);
    }
}
