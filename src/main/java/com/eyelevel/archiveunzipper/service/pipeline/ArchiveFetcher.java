package com.eyelevel.archiveunzipper.service.pipeline;

import com.eyelevel.archiveunzipper.config.UnzipProcessingConfig;
import com.eyelevel.archiveunzipper.exception.ArchiveExtractionException;
import com.eyelevel.archiveunzipper.exception.SourceContainerNotFoundException;
import com.eyelevel.archiveunzipper.exception.SourceObjectNotFoundException;
import com.eyelevel.archiveunzipper.service.storage.ObjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates the source location and loads the archive into memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArchiveFetcher {

    private final UnzipProcessingConfig config;

    /**
     * Checks that the container and the object exist, then downloads the whole object.
     *
     * @throws SourceContainerNotFoundException if the container does not exist.
     * @throws SourceObjectNotFoundException    if the object does not exist.
     * @throws ArchiveExtractionException       if the object exceeds the configured size limit.
     */
    public byte[] fetch(final ObjectStore source, final String container, final String objectName) {
        if (!source.containerExists(container)) {
            throw new SourceContainerNotFoundException(container);
        }
        if (!source.objectExists(container, objectName)) {
            throw new SourceObjectNotFoundException(objectName);
        }

        final long limit = config.getMaxArchiveSizeBytes();
        if (limit > 0) {
            final long size = source.objectSize(container, objectName);
            if (size > limit) {
                throw new ArchiveExtractionException(String.format(
                        "Source object '%s' is %d bytes, exceeding the limit of %d bytes.", objectName, size, limit));
            }
        }

        final byte[] archive = source.download(container, objectName);
        log.info("Downloaded archive '{}' from container '{}' ({} bytes).", objectName, container, archive.length);
        return archive;
    }
}
