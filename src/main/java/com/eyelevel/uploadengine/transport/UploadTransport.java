package com.eyelevel.uploadengine.transport;

import com.eyelevel.uploadengine.model.AttemptResult;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.UploadRequest;

/**
 * Defines the contract for the component that actually moves bytes to a provider.
 * <p>
 * Implementations own the wire protocol, authentication and TLS. The engine calls them once per attempt and
 * handles retries, health and failover itself, so implementations should not retry internally.
 */
public interface UploadTransport {

    /**
     * Performs a single upload attempt.
     *
     * @param provider the destination.
     * @param request  the upload to perform.
     * @return the outcome of the attempt; failures should be reported here rather than thrown.
     */
    AttemptResult attemptUpload(Provider provider, UploadRequest request);

    /**
     * Performs a lightweight connectivity probe.
     *
     * @param provider the provider to probe.
     * @return {@code true} if the provider is reachable with its current configuration.
     */
    boolean testConnection(Provider provider);

    /**
     * Releases any client or connection cached for a provider. Called after reconfiguration and removal.
     *
     * @param providerId the provider whose resources should be released.
     */
    default void evict(String providerId) {
    }
}
