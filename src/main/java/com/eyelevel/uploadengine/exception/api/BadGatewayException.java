package com.eyelevel.uploadengine.exception.api;

import java.io.Serial;

/**
 * Exception indicating that every upstream storage provider failed the request (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5198830274716622090L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
