package com.eyelevel.uploadengine.exception.api;

import java.io.Serial;

/**
 * Exception indicating an invalid request (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -4410318927562209371L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
