package com.eyelevel.archiveunzipper.exception;

import com.eyelevel.archiveunzipper.model.UnzipFailureKind;

import java.io.Serial;

/**
 * Thrown when the container that should hold the source archive does not exist.
 */
public class SourceContainerNotFoundException extends UnzipProcessingException {
    @Serial
    private static final long serialVersionUID = -2271394011857360841L;

    public SourceContainerNotFoundException(String containerName) {
        super(UnzipFailureKind.SOURCE_CONTAINER_NOT_FOUND,
              String.format("Source container '%s' not found.", containerName));
    }
}
