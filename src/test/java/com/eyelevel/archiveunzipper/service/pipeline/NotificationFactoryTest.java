package com.eyelevel.archiveunzipper.service.pipeline;

import com.eyelevel.archiveunzipper.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.archiveunzipper.config.UnzipProcessingConfig;
import com.eyelevel.archiveunzipper.dto.unzip.request.UnzipRequest;
import com.eyelevel.archiveunzipper.service.messaging.OutboundMessage;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationFactoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NotificationFactory factory =
            new NotificationFactory(new JacksonJsonSerializer(objectMapper), new UnzipProcessingConfig());

    private final UnzipRequest request = UnzipRequest.builder()
            .sourceBlobName("in/archive.zip")
            .correlationId("CORR-9")
            .intId("INT-3")
            .eventType("OrderFiles")
            .zipFileName("archive.zip")
            .build();

    @Test
    void create_BodyAndAttributesCarryTheSameFields() throws Exception {
        OutboundMessage message = factory.create(request, "orders.csv", "drop/orders.csv");

        Map<String, String> body = objectMapper.readValue(message.body(), new TypeReference<>() {
        });
        assertEquals(message.attributes(), body);
        assertEquals(List.of("IntId", "TransactionId", "CorrelationId", "FileName", "ArchiveBlobFullPath",
                             "ZipFileName", "EventType", "UnzipBlobFullPath"), List.copyOf(body.keySet()));
        assertEquals("INT-3", body.get("IntId"));
        assertEquals("CORR-9", body.get("CorrelationId"));
        assertEquals("orders.csv", body.get("FileName"));
        assertEquals("in/archive.zip", body.get("ArchiveBlobFullPath"));
        assertEquals("archive.zip", body.get("ZipFileName"));
        assertEquals("OrderFiles", body.get("EventType"));
        assertEquals("drop/orders.csv", body.get("UnzipBlobFullPath"));
        assertEquals("CORR-9", message.groupKey());
    }

    @Test
    void create_GeneratesFreshIdsPerMessage() {
        OutboundMessage first = factory.create(request, "a.csv", "drop/a.csv");
        OutboundMessage second = factory.create(request, "a.csv", "drop/a.csv");

        String transactionId = first.attributes().get("TransactionId");
        assertTrue(transactionId.matches("TRANS[0-9A-F]{8}-[0-9A-F]{4}-[0-9A-F]{4}-[0-9A-F]{4}-[0-9A-F]{12}"));
        assertNotEquals(transactionId, second.attributes().get("TransactionId"));
        assertNotEquals(first.messageId(), second.messageId());
        assertNotEquals(request.correlationId(), transactionId);
    }
}
