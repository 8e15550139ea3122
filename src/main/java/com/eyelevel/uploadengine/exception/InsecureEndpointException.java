package com.eyelevel.uploadengine.exception;

import java.io.Serial;

/**
 * Raised when a provider requires encrypted transport but its endpoint is not HTTPS.
 */
public class InsecureEndpointException extends UploadEngineException {
    @Serial
    private static final long serialVersionUID = 3391528046470713942L;

    public InsecureEndpointException(String message) {
        super(message);
    }
}
