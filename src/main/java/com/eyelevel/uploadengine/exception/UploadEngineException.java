package com.eyelevel.uploadengine.exception;

import java.io.Serial;

/**
 * A base exception for errors raised by the upload engine.
 */
public class UploadEngineException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6204721383406152918L;

    public UploadEngineException(String message) {
        super(message);
    }

    public UploadEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
