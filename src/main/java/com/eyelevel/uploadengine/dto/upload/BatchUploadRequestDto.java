package com.eyelevel.uploadengine.dto.upload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@Schema(description = "A DTO for uploading several payloads in one call.")
public class BatchUploadRequestDto {

    @Valid
    @NotEmpty(message = "The 'items' list cannot be empty.")
    private List<UploadRequestDto> items;
}
