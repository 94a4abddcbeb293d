package com.eyelevel.archiveunzipper.exception;

import com.eyelevel.archiveunzipper.model.UnzipFailureKind;
import lombok.Getter;

import java.io.Serial;

/**
 * A base exception for errors that stop an unzip run. Each subclass fixes the {@link UnzipFailureKind}
 * reported for the run.
 */
@Getter
public class UnzipProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    private final UnzipFailureKind kind;

    public UnzipProcessingException(UnzipFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public UnzipProcessingException(UnzipFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
