package com.eyelevel.uploadengine.dto.upload;

import com.eyelevel.uploadengine.model.UploadPriority;
import com.eyelevel.uploadengine.model.UploadRequest;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Schema(description = "A DTO describing a single upload.")
public class UploadRequestDto {

    @Schema(description = "Caller-chosen request id. Generated when omitted.", example = "req-42", nullable = true)
    private String requestId;

    @PositiveOrZero(message = "The 'estimatedSizeBytes' must not be negative.")
    @Schema(description = "Estimated payload size, used for cost estimation and selection.", example = "10485760")
    private long estimatedSizeBytes;

    @NotBlank(message = "The 'targetPath' field cannot be empty.")
    @Schema(description = "Object key at the provider.", example = "invoices/2024/10/invoice-42.pdf")
    private String targetPath;

    @Schema(description = "Local file holding the payload.", example = "/data/outgoing/invoice-42.pdf", nullable = true)
    private String localPath;

    @Schema(description = "Priority tag. Only affects logging.", example = "HIGH", nullable = true)
    private UploadPriority priority;

    @PositiveOrZero(message = "The 'maxRetries' must not be negative.")
    @Max(value = 10, message = "The 'maxRetries' must not exceed 10.")
    @Schema(description = "Retries per provider. Falls back to the configured default.", example = "3", nullable = true)
    private Integer maxRetries;

    @Schema(description = "Advisory deadline. Not enforced.", nullable = true)
    private Instant deadline;

    public UploadRequest toUploadRequest(final int defaultMaxRetries) {
        return UploadRequest.builder()
                            .requestId(StringUtils.hasText(requestId) ? requestId : UUID.randomUUID().toString())
                            .estimatedSizeBytes(estimatedSizeBytes)
                            .targetPath(targetPath)
                            .localPath(StringUtils.hasText(localPath) ? Path.of(localPath) : null)
                            .priority(priority != null ? priority : UploadPriority.MEDIUM)
                            .maxRetries(maxRetries != null ? maxRetries : defaultMaxRetries)
                            .deadline(deadline)
                            .build();
    }
}
