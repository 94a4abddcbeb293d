package com.eyelevel.archiveunzipper.model;

/**
 * Classifies why an unzip run stopped. Every kind is terminal for the run; none is retried internally.
 */
public enum UnzipFailureKind {

    /**
     * The source container (bucket) does not exist.
     */
    SOURCE_CONTAINER_NOT_FOUND,

    /**
     * The source archive object does not exist in its container.
     */
    SOURCE_OBJECT_NOT_FOUND,

    /**
     * The archive could not be opened or read as a ZIP archive.
     */
    EXTRACTION_FAILURE,

    /**
     * Writing an extracted entry to the destination failed. Later entries are not processed.
     */
    UPLOAD_FAILURE,

    /**
     * Sending the notification for an uploaded entry failed. Later entries are not processed.
     */
    PUBLISH_FAILURE,

    /**
     * Any other error raised by a collaborator.
     */
    UNKNOWN_FAILURE
}
