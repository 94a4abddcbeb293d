package com.eyelevel.archiveunzipper.service.pipeline;

import com.eyelevel.archiveunzipper.common.json.JsonSerializer;
import com.eyelevel.archiveunzipper.config.UnzipProcessingConfig;
import com.eyelevel.archiveunzipper.dto.unzip.request.UnzipRequest;
import com.eyelevel.archiveunzipper.model.UnzipNotification;
import com.eyelevel.archiveunzipper.service.messaging.OutboundMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Builds the message announcing one uploaded entry. Every call generates a fresh transaction id and
 * message id.
 */
@Component
@RequiredArgsConstructor
public class NotificationFactory {

    private final JsonSerializer jsonSerializer;
    private final UnzipProcessingConfig config;

    public OutboundMessage create(final UnzipRequest request, final String fileName, final String destinationKey) {
        final UnzipNotification notification = UnzipNotification.builder()
                .integrationId(request.intId())
                .transactionId(newTransactionId())
                .correlationId(request.correlationId())
                .fileName(fileName)
                .archiveBlobFullPath(request.sourceBlobName())
                .zipFileName(request.zipFileName())
                .eventType(request.eventType())
                .unzipBlobFullPath(destinationKey)
                .build();

        return new OutboundMessage(UUID.randomUUID().toString(), jsonSerializer.serialize(notification),
                                   notification.toAttributes(), request.correlationId());
    }

    private String newTransactionId() {
        return config.getTransactionIdPrefix() + UUID.randomUUID().toString().toUpperCase(Locale.ROOT);
    }
}
