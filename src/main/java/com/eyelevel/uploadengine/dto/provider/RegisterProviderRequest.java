package com.eyelevel.uploadengine.dto.provider;

import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.ProviderPlatform;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "A DTO for registering a new upload provider.")
public class RegisterProviderRequest {

    @NotBlank(message = "The 'id' field cannot be empty.")
    @Schema(description = "Unique provider id.", example = "aws-primary")
    private String id;

    @Schema(description = "Vendor family (aws, azure, gcp, custom). Informational only.", example = "aws", nullable = true)
    private String platform;

    @PositiveOrZero(message = "The 'priority' must not be negative.")
    @Schema(description = "Failover rank; lower values are tried first.", example = "1")
    private int priority;

    @Valid
    @NotNull(message = "The 'config' field is required.")
    private ProviderConfigRequest config;

    public Provider toProvider() {
        return Provider.builder()
                       .id(id)
                       .platform(ProviderPlatform.convertByValue(platform))
                       .priority(priority)
                       .config(config.toProviderConfig())
                       .build();
    }
}
