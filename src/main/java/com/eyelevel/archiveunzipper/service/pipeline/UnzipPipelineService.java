package com.eyelevel.archiveunzipper.service.pipeline;

import com.eyelevel.archiveunzipper.dto.unzip.request.UnzipRequest;
import com.eyelevel.archiveunzipper.exception.UnzipProcessingException;
import com.eyelevel.archiveunzipper.model.TaskStatus;
import com.eyelevel.archiveunzipper.model.UnzipFailureKind;
import com.eyelevel.archiveunzipper.model.UnzipOutcome;
import com.eyelevel.archiveunzipper.service.identity.IdentityProvider;
import com.eyelevel.archiveunzipper.service.storage.ObjectStore;
import com.eyelevel.archiveunzipper.service.storage.ObjectStoreFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the unzip pipeline for one request and reports its outcome.
 * <p>
 * The archive is fetched, then its entries are uploaded and announced. Whatever happens, the caller gets a
 * status back; errors are logged and turned into the status text, never rethrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UnzipPipelineService {

    private final IdentityProvider identityProvider;
    private final ObjectStoreFactory objectStoreFactory;
    private final ArchiveFetcher archiveFetcher;
    private final ArchiveEntryPublisher archiveEntryPublisher;

    /**
     * Runs the pipeline and returns the status record for the caller.
     *
     * @param request the run parameters.
     * @return the success text, or {@code "Error: "} followed by the failure message.
     */
    public TaskStatus run(final UnzipRequest request) {
        final TaskStatus status = TaskStatus.starting();
        final UnzipOutcome outcome = execute(request);
        status.setCurrentTaskStatus(outcome.toStatusText());
        return status;
    }

    /**
     * Runs the pipeline and returns the classified outcome.
     */
    public UnzipOutcome execute(final UnzipRequest request) {
        final AtomicInteger published = new AtomicInteger();
        log.info("[{}] Starting unzip of '{}' from container '{}' into '{}/{}'.", request.correlationId(),
                 request.sourceBlobName(), request.sourceContainerName(), request.destinationContainerName(),
                 request.destinationFolderName());
        try {
            final AwsCredentialsProvider credentials = identityProvider.acquireCredential();

            final byte[] archive;
            try (ObjectStore source = objectStoreFactory.open(request.sourceBlobUrl(), credentials)) {
                archive = archiveFetcher.fetch(source, request.sourceContainerName(), request.sourceBlobName());
            }

            try (ObjectStore destination = objectStoreFactory.open(request.destinationBlobUrl(), credentials)) {
                archiveEntryPublisher.publishEntries(archive, destination, request, credentials, published);
            }

            log.info("[{}] Unzip of '{}' completed: {} file(s) uploaded and announced.", request.correlationId(),
                     request.sourceBlobName(), published.get());
            return UnzipOutcome.success(published.get());
        } catch (UnzipProcessingException e) {
            log.error("[{}] Unzip of '{}' failed ({}) after {} file(s).", request.correlationId(),
                      request.sourceBlobName(), e.getKind(), published.get(), e);
            return UnzipOutcome.failure(e.getKind(), e.getMessage(), published.get());
        } catch (Exception e) {
            log.error("[{}] Unexpected error during unzip of '{}' after {} file(s).", request.correlationId(),
                      request.sourceBlobName(), published.get(), e);
            return UnzipOutcome.failure(UnzipFailureKind.UNKNOWN_FAILURE, describe(e), published.get());
        }
    }

    private static String describe(final Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
