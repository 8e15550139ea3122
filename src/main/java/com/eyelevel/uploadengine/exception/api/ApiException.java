package com.eyelevel.uploadengine.exception.api;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors surfaced through the HTTP layer, carrying the status code to respond with.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 2217480356195713560L;
    private final int statusCode;

    /**
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
