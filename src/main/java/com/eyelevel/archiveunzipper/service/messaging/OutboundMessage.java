package com.eyelevel.archiveunzipper.service.messaging;

import java.util.Map;

/**
 * A message ready to be sent.
 *
 * @param messageId  unique id generated for this message.
 * @param body       serialized message body.
 * @param attributes routing attributes mirrored from the body.
 * @param groupKey   ordering key for destinations that group messages (FIFO queues).
 */
public record OutboundMessage(String messageId, String body, Map<String, String> attributes, String groupKey) {

    public OutboundMessage {
        attributes = Map.copyOf(attributes);
    }
}
