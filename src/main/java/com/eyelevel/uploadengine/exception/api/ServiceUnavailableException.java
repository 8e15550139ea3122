package com.eyelevel.uploadengine.exception.api;

import java.io.Serial;

/**
 * Exception indicating that no storage provider is currently available (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -892145530117248804L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
