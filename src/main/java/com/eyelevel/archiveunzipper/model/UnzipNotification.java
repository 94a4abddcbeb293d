package com.eyelevel.archiveunzipper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The body of the message announcing one extracted entry. The same fields are sent as message
 * attributes so consumers can route on them without reading the body.
 *
 * @param integrationId       the integration the archive belongs to.
 * @param transactionId       generated per entry.
 * @param correlationId       supplied by the caller, shared by every message of the run.
 * @param fileName            leaf name of the extracted entry.
 * @param archiveBlobFullPath object name of the source archive.
 * @param zipFileName         archive file name supplied by the caller.
 * @param eventType           caller-supplied event type.
 * @param unzipBlobFullPath   destination object the entry was written to.
 */
@Builder
@JsonPropertyOrder({"IntId", "TransactionId", "CorrelationId", "FileName", "ArchiveBlobFullPath", "ZipFileName",
        "EventType", "UnzipBlobFullPath"})
public record UnzipNotification(
        @JsonProperty("IntId") String integrationId,
        @JsonProperty("TransactionId") String transactionId,
        @JsonProperty("CorrelationId") String correlationId,
        @JsonProperty("FileName") String fileName,
        @JsonProperty("ArchiveBlobFullPath") String archiveBlobFullPath,
        @JsonProperty("ZipFileName") String zipFileName,
        @JsonProperty("EventType") String eventType,
        @JsonProperty("UnzipBlobFullPath") String unzipBlobFullPath
) {

    public Map<String, String> toAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("IntId", integrationId);
        attributes.put("TransactionId", transactionId);
        attributes.put("CorrelationId", correlationId);
        attributes.put("FileName", fileName);
        attributes.put("ArchiveBlobFullPath", archiveBlobFullPath);
        attributes.put("ZipFileName", zipFileName);
        attributes.put("EventType", eventType);
        attributes.put("UnzipBlobFullPath", unzipBlobFullPath);
        return attributes;
    }
}
