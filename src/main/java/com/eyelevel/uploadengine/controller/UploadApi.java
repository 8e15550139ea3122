package com.eyelevel.uploadengine.controller;

import com.eyelevel.uploadengine.dto.common.ApiResponse;
import com.eyelevel.uploadengine.dto.upload.BatchUploadRequestDto;
import com.eyelevel.uploadengine.dto.upload.UploadRequestDto;
import com.eyelevel.uploadengine.model.BatchUploadResult;
import com.eyelevel.uploadengine.model.UploadResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;

@Tag(name = "Uploads", description = "Endpoints for uploading payloads with automatic provider selection, retry and failover.")
public interface UploadApi {

    @Operation(summary = "Upload with Failover",
            description = "Uploads to the optimal provider, retrying with backoff, and fails over to the remaining healthy providers in priority order.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Payload accepted by a provider.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Upload completed via failover.",
                                        "response": {
                                            "requestId": "req-42",
                                            "status": "FAILED_OVER",
                                            "providerId": "gcp-secondary",
                                            "attemptedProviders": ["aws-primary", "gcp-secondary"]
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid upload description.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Bad Gateway - Every provider failed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Service Unavailable - No healthy provider.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadResult>> upload(@Valid @RequestBody UploadRequestDto request);

    @Operation(summary = "Batch Upload",
            description = "Groups the items by selected provider and uploads them group by group. Items that fail in their group fall back to failover individually. Always returns per-item results.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Batch processed; inspect the per-item statuses.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Empty or invalid batch.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<BatchUploadResult>> batchUpload(@Valid @RequestBody BatchUploadRequestDto request);

    @Operation(summary = "Upload with Load Balancing",
            description = "Picks the provider with the active load balancing strategy only, skipping the cost-first shortcut, then fails over on exhaustion.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Payload accepted by a provider.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Bad Gateway - Every provider failed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Service Unavailable - No healthy provider.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadResult>> uploadWithLoadBalancing(@Valid @RequestBody UploadRequestDto request);
}
