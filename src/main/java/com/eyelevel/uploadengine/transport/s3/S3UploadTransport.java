package com.eyelevel.uploadengine.transport.s3;

import com.eyelevel.uploadengine.exception.InsecureEndpointException;
import com.eyelevel.uploadengine.model.AttemptResult;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.UploadRequest;
import com.eyelevel.uploadengine.transport.UploadTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;

/**
 * Uploads payloads to S3-compatible object storage. Each attempt is a single PutObject of the request's local
 * file to {@code bucket/targetPath}; the connectivity probe is a HeadBucket.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3UploadTransport implements UploadTransport {

    private final S3ClientFactory clientFactory;
    private final Clock clock;

    @Override
    public AttemptResult attemptUpload(final Provider provider, final UploadRequest request) {
        final long start = clock.millis();
        if (request.getLocalPath() == null || !Files.isRegularFile(request.getLocalPath())) {
            log.warn("[{}] Local file '{}' not found; nothing to upload", request.getRequestId(),
                    request.getLocalPath());
            return AttemptResult.failure(clock.millis() - start, "Local file not found: " + request.getLocalPath());
        }
        final PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                                                                  .bucket(provider.getConfig().getBucketName())
                                                                  .key(request.getTargetPath())
                                                                  .build();
        try {
            final long size = Files.size(request.getLocalPath());
            clientFactory.clientFor(provider).putObject(putObjectRequest, RequestBody.fromFile(request.getLocalPath()));
            final long elapsed = clock.millis() - start;
            log.debug("[{}] Uploaded {} bytes to '{}/{}' on provider '{}' in {}ms", request.getRequestId(), size,
                    provider.getConfig().getBucketName(), request.getTargetPath(), provider.getId(), elapsed);
            return AttemptResult.success(elapsed, size);
        } catch (SdkException e) {
            log.warn("[{}] S3 upload to provider '{}' failed: {}", request.getRequestId(), provider.getId(),
                    e.getMessage());
            return AttemptResult.failure(clock.millis() - start, e.getMessage());
        } catch (IOException e) {
            log.warn("[{}] Could not read local file '{}'", request.getRequestId(), request.getLocalPath(), e);
            return AttemptResult.failure(clock.millis() - start, e.getMessage());
        } catch (InsecureEndpointException e) {
            log.error("[{}] Refusing upload: {}", request.getRequestId(), e.getMessage());
            return AttemptResult.failure(clock.millis() - start, e.getMessage());
        }
    }

    @Override
    public boolean testConnection(final Provider provider) {
        try {
            clientFactory.clientFor(provider)
                         .headBucket(HeadBucketRequest.builder().bucket(provider.getConfig().getBucketName()).build());
            return true;
        } catch (SdkException e) {
            log.warn("Connection test for provider '{}' failed: {}", provider.getId(), e.getMessage());
            return false;
        } catch (InsecureEndpointException e) {
            log.error("Connection test for provider '{}' refused: {}", provider.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void evict(final String providerId) {
        clientFactory.evict(providerId);
    }
}
