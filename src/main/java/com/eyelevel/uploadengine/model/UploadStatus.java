package com.eyelevel.uploadengine.model;

/**
 * Final status of an upload handed to the engine.
 */
public enum UploadStatus {
    /**
     * Accepted by the first provider that was tried.
     */
    UPLOADED,
    /**
     * The first provider was exhausted and another provider accepted the upload.
     */
    FAILED_OVER,
    /**
     * Every healthy provider was tried and exhausted.
     */
    EXHAUSTED,
    /**
     * No healthy provider existed, so no transport call was made.
     */
    NO_PROVIDER_AVAILABLE;

    public boolean isSuccessful() {
        return this == UPLOADED || this == FAILED_OVER;
    }
}
