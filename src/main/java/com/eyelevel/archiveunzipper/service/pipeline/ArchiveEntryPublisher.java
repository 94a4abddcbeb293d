package com.eyelevel.archiveunzipper.service.pipeline;

import com.eyelevel.archiveunzipper.dto.unzip.request.UnzipRequest;
import com.eyelevel.archiveunzipper.exception.EntryUploadException;
import com.eyelevel.archiveunzipper.exception.NotificationPublishException;
import com.eyelevel.archiveunzipper.exception.UnzipProcessingException;
import com.eyelevel.archiveunzipper.service.messaging.NotificationChannel;
import com.eyelevel.archiveunzipper.service.messaging.NotificationChannelFactory;
import com.eyelevel.archiveunzipper.service.messaging.NotificationSender;
import com.eyelevel.archiveunzipper.service.messaging.OutboundMessage;
import com.eyelevel.archiveunzipper.service.storage.ObjectKeys;
import com.eyelevel.archiveunzipper.service.storage.ObjectStore;
import com.eyelevel.archiveunzipper.service.zip.ZipArchiveReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;

import java.io.InputStream;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extracts every file entry of a buffered archive, uploads it and announces it.
 * <p>
 * Entries are handled one at a time. An entry's notification is sent only after its upload has completed.
 * The first failing entry stops the run; entries already uploaded and announced stay in place.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArchiveEntryPublisher {

    private final ZipArchiveReader zipArchiveReader;
    private final NotificationChannelFactory notificationChannelFactory;
    private final NotificationFactory notificationFactory;

    /**
     * @param archive     the complete archive content.
     * @param destination object store receiving the extracted files.
     * @param request     the run parameters.
     * @param credentials the run's credential, used for the messaging connection.
     * @param published   incremented after each entry is uploaded and announced.
     * @throws UnzipProcessingException on the first entry that cannot be uploaded or announced, or if the
     *                                  archive cannot be read.
     */
    public void publishEntries(final byte[] archive, final ObjectStore destination, final UnzipRequest request,
                               final AwsCredentialsProvider credentials, final AtomicInteger published) {
        try (NotificationChannel channel = notificationChannelFactory.open(credentials);
             NotificationSender sender = openSender(channel, request.topicName())) {

            zipArchiveReader.readEntries(archive, (entry, content) -> {
                final String destinationKey = ObjectKeys.destinationKey(request.destinationFolderName(),
                                                                        entry.leafName());
                upload(destination, request.destinationContainerName(), destinationKey, content, entry.size());

                final OutboundMessage message = notificationFactory.create(request, entry.leafName(), destinationKey);
                send(sender, message, destinationKey);

                published.incrementAndGet();
                log.info("[{}] Extracted '{}' to '{}' and sent message {}.", request.correlationId(),
                         entry.fullPath(), destinationKey, message.messageId());
            });
        }
    }

    private NotificationSender openSender(final NotificationChannel channel, final String topicName) {
        try {
            return channel.createSender(topicName);
        } catch (RuntimeException e) {
            throw new NotificationPublishException(
                    String.format("Failed to open sender for topic '%s': %s", topicName, e.getMessage()), e);
        }
    }

    private void upload(final ObjectStore destination, final String container, final String destinationKey,
                        final InputStream content, final long size) {
        try {
            destination.upload(container, destinationKey, content, size);
        } catch (RuntimeException e) {
            throw new EntryUploadException(
                    String.format("Failed to upload '%s' to container '%s': %s", destinationKey, container,
                                  e.getMessage()), e);
        }
    }

    private void send(final NotificationSender sender, final OutboundMessage message, final String destinationKey) {
        try {
            sender.send(message);
        } catch (RuntimeException e) {
            throw new NotificationPublishException(
                    String.format("Failed to send notification for '%s': %s", destinationKey, e.getMessage()), e);
        }
    }
}
