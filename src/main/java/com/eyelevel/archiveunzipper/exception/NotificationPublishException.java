package com.eyelevel.archiveunzipper.exception;

import com.eyelevel.archiveunzipper.model.UnzipFailureKind;

import java.io.Serial;

/**
 * Thrown when the notification for an uploaded entry could not be sent, or the sender
 * for the requested destination could not be created.
 */
public class NotificationPublishException extends UnzipProcessingException {
    @Serial
    private static final long serialVersionUID = 3546738330082948966L;

    public NotificationPublishException(String message, Throwable cause) {
        super(UnzipFailureKind.PUBLISH_FAILURE, message, cause);
    }
}
