package com.eyelevel.uploadengine.exception.api;

import java.io.Serial;

/**
 * Exception indicating that a provider or resource was not found (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3051703506470244006L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
