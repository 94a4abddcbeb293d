package com.eyelevel.archiveunzipper.dto.unzip.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * The parameters of one unzip run. Field names follow the workflow action that originally invoked the
 * function; the PascalCase spelling of that action is accepted as well.
 *
 * @param sourceBlobUrl            endpoint URL of the object store holding the archive.
 * @param destinationBlobUrl       endpoint URL of the object store receiving the extracted files.
 * @param sourceContainerName      container (bucket) of the archive.
 * @param destinationContainerName container (bucket) receiving the extracted files.
 * @param sourceBlobName           object name of the archive.
 * @param destinationFolderName    folder prefix for the extracted files; may be empty.
 * @param topicName                name of the queue the notifications are sent to.
 * @param correlationId            caller-supplied id linking every message of the business transaction.
 * @param intId                    integration id.
 * @param eventType                event type copied into every notification.
 * @param zipFileName              archive file name copied into every notification.
 */
@Builder(toBuilder = true)
@Schema(description = "Describes the archive to extract, where its files go and how they are announced.")
public record UnzipRequest(
        @Schema(example = "https://s3.eu-west-1.amazonaws.com")
        @JsonAlias("SourceBlobUrl") @NotBlank(message = "The 'sourceBlobUrl' cannot be empty.") String sourceBlobUrl,

        @Schema(example = "https://s3.eu-west-1.amazonaws.com")
        @JsonAlias("DestinationBlobUrl") @NotBlank(message = "The 'destinationBlobUrl' cannot be empty.") String destinationBlobUrl,

        @Schema(example = "inbound-archives")
        @JsonAlias("SourceContainerName") @NotBlank(message = "The 'sourceContainerName' cannot be empty.") String sourceContainerName,

        @Schema(example = "extracted-files")
        @JsonAlias("DestinationContainerName") @NotBlank(message = "The 'destinationContainerName' cannot be empty.") String destinationContainerName,

        @Schema(example = "2024/06/shipments.zip")
        @JsonAlias("SourceBlobName") @NotBlank(message = "The 'sourceBlobName' cannot be empty.") String sourceBlobName,

        @Schema(example = "shipments/2024-06-01", description = "May be empty to write at the container root.")
        @JsonAlias("DestinationFolderName") @NotNull(message = "The 'destinationFolderName' must be provided.") String destinationFolderName,

        @Schema(example = "unzipped-file-events")
        @JsonAlias("TopicName") @NotBlank(message = "The 'topicName' cannot be empty.") String topicName,

        @JsonAlias("CorrelationId") @NotBlank(message = "The 'correlationId' cannot be empty.") String correlationId,

        @JsonAlias("IntId") @NotBlank(message = "The 'intId' cannot be empty.") String intId,

        @JsonAlias("EventType") @NotBlank(message = "The 'eventType' cannot be empty.") String eventType,

        @JsonAlias("ZipFileName") @NotBlank(message = "The 'zipFileName' cannot be empty.") String zipFileName
) {
}
