package com.eyelevel.uploadengine.dto.provider;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "A DTO for moving traffic away from one provider to another.")
public class FailoverRequest {

    @NotBlank(message = "The 'fromProviderId' field cannot be empty.")
    @Schema(description = "Provider to take out of rotation.", example = "aws-primary")
    private String fromProviderId;

    @NotBlank(message = "The 'toProviderId' field cannot be empty.")
    @Schema(description = "Healthy provider expected to take over.", example = "gcp-secondary")
    private String toProviderId;
}
