package com.eyelevel.archiveunzipper.exception;

import com.eyelevel.archiveunzipper.model.UnzipFailureKind;

import java.io.Serial;

/**
 * Thrown when the downloaded archive cannot be opened or read as a ZIP archive,
 * or is rejected before extraction starts.
 */
public class ArchiveExtractionException extends UnzipProcessingException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public ArchiveExtractionException(String message) {
        super(UnzipFailureKind.EXTRACTION_FAILURE, message);
    }

    public ArchiveExtractionException(String message, Throwable cause) {
        super(UnzipFailureKind.EXTRACTION_FAILURE, message, cause);
    }
}
