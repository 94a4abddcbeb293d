package com.eyelevel.archiveunzipper.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized wrapper for API error responses, giving clients one structure to read
 * whenever a request is rejected before a run starts.
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
     * Technical detail of the error, if any.
     */
    private final String errorDetail;

    /**
     * The response data.
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

    public static <T> ApiResponse<T> error(String displayMessage) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).showMessage(true).build();
    }

    public static <T> ApiResponse<T> error(String displayMessage, String errorDetail) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).errorDetail(errorDetail).showMessage(true)
                          .build();
    }
}
