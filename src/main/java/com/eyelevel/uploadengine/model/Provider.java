package com.eyelevel.uploadengine.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * A registered upload destination.
 *
 * @see com.eyelevel.uploadengine.registry.ProviderRegistry
 */
@Value
@Builder(toBuilder = true)
public class Provider {

    @NonNull
    String id;
    @Builder.Default
    ProviderPlatform platform = ProviderPlatform.CUSTOM;
    /**
     * Tie-break and failover order; lower values are tried first.
     */
    int priority;
    @With
    @NonNull
    ProviderConfig config;
}
