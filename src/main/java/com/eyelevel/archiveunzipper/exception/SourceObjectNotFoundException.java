package com.eyelevel.archiveunzipper.exception;

import com.eyelevel.archiveunzipper.model.UnzipFailureKind;

import java.io.Serial;

/**
 * Thrown when the source archive object is missing from an existing container.
 */
public class SourceObjectNotFoundException extends UnzipProcessingException {
    @Serial
    private static final long serialVersionUID = 6016442731409518172L;

    public SourceObjectNotFoundException(String objectName) {
        super(UnzipFailureKind.SOURCE_OBJECT_NOT_FOUND, String.format("Source object '%s' not found.", objectName));
    }
}
