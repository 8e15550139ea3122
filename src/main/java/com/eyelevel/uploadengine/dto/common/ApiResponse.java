package com.eyelevel.uploadengine.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses,
 * making it easy for clients to handle them.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data. For errors, an optional technical detail.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    public static <T> ApiResponse<T> ok(final String displayMessage, final T response) {
        return ApiResponse.<T>builder()
                          .displayMessage(displayMessage)
                          .response(response)
                          .showMessage(true)
                          .statusCode(200)
                          .build();
    }

    public static ApiResponse<Object> error(final String displayMessage, final int statusCode) {
        return ApiResponse.builder().displayMessage(displayMessage).showMessage(true).statusCode(statusCode).build();
    }

    public static ApiResponse<Object> error(final String displayMessage, final String detail, final int statusCode) {
        return ApiResponse.builder()
                          .displayMessage(displayMessage)
                          .response(detail)
                          .showMessage(true)
                          .statusCode(statusCode)
                          .build();
    }
}
