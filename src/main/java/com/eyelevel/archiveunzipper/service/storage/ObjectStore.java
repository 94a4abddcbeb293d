package com.eyelevel.archiveunzipper.service.storage;

import java.io.InputStream;

/**
 * An object store endpoint addressed by container and object name. Instances are opened for one run and
 * closed when the run ends.
 */
public interface ObjectStore extends AutoCloseable {

    boolean containerExists(String container);

    boolean objectExists(String container, String objectName);

    /**
     * @return the size of the object in bytes.
     */
    long objectSize(String container, String objectName);

    /**
     * Reads the whole object into memory.
     */
    byte[] download(String container, String objectName);

    /**
     * Streams {@code content} into the object, replacing any object already stored under that name.
     * Returns once the store has acknowledged the write.
     *
     * @param contentLength exact number of bytes {@code content} will yield.
     */
    void upload(String container, String objectName, InputStream content, long contentLength);

    @Override
    void close();
}
