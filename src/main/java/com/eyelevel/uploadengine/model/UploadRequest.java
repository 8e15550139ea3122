package com.eyelevel.uploadengine.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One unit of work handed to the engine by its caller. Immutable; the retry counter of an
 * attempt sequence lives in the retry context, not here.
 */
@Value
@Builder(toBuilder = true)
public class UploadRequest {

    @NonNull
    String requestId;
    long estimatedSizeBytes;
    @NonNull
    String targetPath;
    /**
     * Local file backing the payload, if the transport reads from disk.
     */
    Path localPath;
    @Builder.Default
    UploadPriority priority = UploadPriority.MEDIUM;
    int maxRetries;
    /**
     * Advisory only; the engine does not enforce it.
     */
    Instant deadline;
}
