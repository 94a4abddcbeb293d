package com.eyelevel.archiveunzipper.exception.json;

import java.io.Serial;

/**
 * Raised when a notification payload cannot be written as JSON.
 */
public class JsonSerializationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2907114538026631740L;

    public JsonSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
