package com.eyelevel.archiveunzipper.exception;

import com.eyelevel.archiveunzipper.model.UnzipFailureKind;

import java.io.Serial;

/**
 * Thrown when an extracted entry could not be written to its destination object.
 */
public class EntryUploadException extends UnzipProcessingException {
    @Serial
    private static final long serialVersionUID = -144348853764116326L;

    public EntryUploadException(String message, Throwable cause) {
        super(UnzipFailureKind.UPLOAD_FAILURE, message, cause);
    }
}
