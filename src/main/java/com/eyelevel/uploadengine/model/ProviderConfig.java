package com.eyelevel.uploadengine.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Connection settings of a provider. Replaced as a whole on reconfiguration.
 */
@Value
@Builder(toBuilder = true)
public class ProviderConfig {

    /**
     * Service endpoint, e.g. {@code https://s3.eu-west-1.amazonaws.com}. Empty means the vendor default.
     */
    String endpoint;
    String region;
    String bucketName;
    @Builder.Default
    boolean encryptedTransport = true;
    @Builder.Default
    SyncMode syncMode = SyncMode.OFFLINE_FIRST;
    /**
     * Price per megabyte uploaded. {@code null} falls back to the configured default rate.
     */
    Double costPerMegabyte;
    String accessKey;
    @ToString.Exclude
    String secretKey;
}
