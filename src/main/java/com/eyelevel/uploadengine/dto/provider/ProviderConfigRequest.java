package com.eyelevel.uploadengine.dto.provider;

import com.eyelevel.uploadengine.model.ProviderConfig;
import com.eyelevel.uploadengine.model.SyncMode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@Schema(description = "Connection settings of an upload provider.")
public class ProviderConfigRequest {

    @Schema(description = "Service endpoint. Leave empty for the vendor default.", example = "http://localhost:9000", nullable = true)
    private String endpoint;

    @Schema(description = "Region of the bucket.", example = "eu-west-1", nullable = true)
    private String region;

    @NotBlank(message = "The 'bucketName' field cannot be empty.")
    @Schema(description = "Bucket the payloads are written to.", example = "uploads-primary")
    private String bucketName;

    @Schema(description = "Whether the transport must use TLS.", example = "true", nullable = true)
    private Boolean encryptedTransport;

    @Schema(description = "Synchronization mode of the provider.", example = "OFFLINE_FIRST", nullable = true)
    private SyncMode syncMode;

    @PositiveOrZero(message = "The 'costPerMegabyte' must not be negative.")
    @Schema(description = "Price per megabyte uploaded. Falls back to the configured default rate.", example = "0.023", nullable = true)
    private Double costPerMegabyte;

    @Schema(description = "Access key. Omit to use the default credentials chain.", nullable = true)
    private String accessKey;

    @ToString.Exclude
    @Schema(description = "Secret key. Omit to use the default credentials chain.", nullable = true)
    private String secretKey;

    public ProviderConfig toProviderConfig() {
        final ProviderConfig.ProviderConfigBuilder builder = ProviderConfig.builder()
                                                                           .endpoint(endpoint)
                                                                           .region(region)
                                                                           .bucketName(bucketName)
                                                                           .costPerMegabyte(costPerMegabyte)
                                                                           .accessKey(accessKey)
                                                                           .secretKey(secretKey);
        if (encryptedTransport != null) {
            builder.encryptedTransport(encryptedTransport);
        }
        if (syncMode != null) {
            builder.syncMode(syncMode);
        }
        return builder.build();
    }
}
