package com.eyelevel.uploadengine.controller;

import com.eyelevel.uploadengine.config.UploadEngineConfig;
import com.eyelevel.uploadengine.dto.common.ApiResponse;
import com.eyelevel.uploadengine.dto.upload.BatchUploadRequestDto;
import com.eyelevel.uploadengine.dto.upload.UploadRequestDto;
import com.eyelevel.uploadengine.exception.api.BadGatewayException;
import com.eyelevel.uploadengine.exception.api.ServiceUnavailableException;
import com.eyelevel.uploadengine.failover.FailoverCoordinator;
import com.eyelevel.uploadengine.model.BatchUploadResult;
import com.eyelevel.uploadengine.model.UploadRequest;
import com.eyelevel.uploadengine.model.UploadResult;
import com.eyelevel.uploadengine.model.UploadStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for uploads. Every call blocks until the upload has succeeded or every candidate provider
 * has been exhausted.
 */
@Slf4j
@RestController
@RequestMapping("/uploads")
@RequiredArgsConstructor
public class UploadController implements UploadApi {

    private final FailoverCoordinator failoverCoordinator;
    private final UploadEngineConfig config;

    @Override
    @PostMapping("/v1")
    public ResponseEntity<ApiResponse<UploadResult>> upload(@Valid @RequestBody final UploadRequestDto request) {
        final UploadRequest uploadRequest = request.toUploadRequest(config.getRetry().getDefaultMaxRetries());
        log.info("Received upload request '{}' for target '{}'", uploadRequest.getRequestId(),
                uploadRequest.getTargetPath());
        return toResponse(failoverCoordinator.uploadWithFailover(uploadRequest));
    }

    @Override
    @PostMapping("/v1/batch")
    public ResponseEntity<ApiResponse<BatchUploadResult>> batchUpload(
            @Valid @RequestBody final BatchUploadRequestDto request) {
        final int defaultMaxRetries = config.getRetry().getDefaultMaxRetries();
        final List<UploadRequest> requests = request.getItems().stream()
                                                    .map(item -> item.toUploadRequest(defaultMaxRetries))
                                                    .toList();
        log.info("Received batch upload of {} items", requests.size());

        final BatchUploadResult result = failoverCoordinator.batchUploadOptimized(requests);
        final String message = String.format("%d of %d uploads succeeded.", result.successCount(),
                result.results().size());
        return ResponseEntity.ok(ApiResponse.ok(message, result));
    }

    @Override
    @PostMapping("/v1/load-balanced")
    public ResponseEntity<ApiResponse<UploadResult>> uploadWithLoadBalancing(
            @Valid @RequestBody final UploadRequestDto request) {
        final UploadRequest uploadRequest = request.toUploadRequest(config.getRetry().getDefaultMaxRetries());
        log.info("Received load-balanced upload request '{}'", uploadRequest.getRequestId());
        return toResponse(failoverCoordinator.uploadWithLoadBalancing(uploadRequest));
    }

    private ResponseEntity<ApiResponse<UploadResult>> toResponse(final UploadResult result) {
        if (result.status() == UploadStatus.NO_PROVIDER_AVAILABLE) {
            throw new ServiceUnavailableException("No healthy upload provider is available.");
        }
        if (result.status() == UploadStatus.EXHAUSTED) {
            throw new BadGatewayException("Upload failed on every provider tried: " + result.attemptedProviders());
        }
        final String message = result.status() == UploadStatus.FAILED_OVER
                ? "Upload completed via failover."
                : "Upload completed successfully.";
        return ResponseEntity.ok(ApiResponse.ok(message, result));
    }
}
