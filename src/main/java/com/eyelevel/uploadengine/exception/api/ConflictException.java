package com.eyelevel.uploadengine.exception.api;

import java.io.Serial;

/**
 * Exception indicating a conflict with existing state, such as a duplicate provider id (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7722381029310550813L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
