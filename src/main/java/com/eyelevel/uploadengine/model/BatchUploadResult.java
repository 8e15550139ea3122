package com.eyelevel.uploadengine.model;

import java.util.List;

/**
 * Per-item results of a batch upload, in the order the items were executed.
 */
public record BatchUploadResult(List<UploadResult> results) {

    public BatchUploadResult {
        results = List.copyOf(results);
    }

    public boolean allSucceeded() {
        return results.stream().allMatch(UploadResult::isSuccessful);
    }

    public long successCount() {
        return results.stream().filter(UploadResult::isSuccessful).count();
    }

    public long failedOverCount() {
        return results.stream().filter(r -> r.status() == UploadStatus.FAILED_OVER).count();
    }
}
