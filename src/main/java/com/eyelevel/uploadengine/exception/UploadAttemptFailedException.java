package com.eyelevel.uploadengine.exception;

import java.io.Serial;

/**
 * Signals a failed transport attempt to the retry template. Never leaves the retry engine.
 */
public class UploadAttemptFailedException extends UploadEngineException {
    @Serial
    private static final long serialVersionUID = -1874200561533402715L;

    public UploadAttemptFailedException(String message) {
        super(message);
    }
}
