package com.eyelevel.uploadengine.model;

/**
 * Outcome of a single transport call.
 *
 * @param success          whether the provider accepted the payload.
 * @param responseTimeMs   time spent on the call.
 * @param bytesTransferred bytes actually sent; zero on failure.
 * @param errorMessage     reason for a failure, {@code null} on success.
 */
public record AttemptResult(boolean success, long responseTimeMs, long bytesTransferred, String errorMessage) {

    public static AttemptResult success(final long responseTimeMs, final long bytesTransferred) {
        return new AttemptResult(true, responseTimeMs, bytesTransferred, null);
    }

    public static AttemptResult failure(final long responseTimeMs, final String errorMessage) {
        return new AttemptResult(false, responseTimeMs, 0L, errorMessage);
    }
}
