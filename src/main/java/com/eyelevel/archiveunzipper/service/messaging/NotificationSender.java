package com.eyelevel.archiveunzipper.service.messaging;

/**
 * Sends messages to one destination. A sender is created once per run and shared by every entry.
 */
public interface NotificationSender extends AutoCloseable {

    /**
     * Sends the message and returns once the messaging service has accepted it.
     */
    void send(OutboundMessage message);

    String destination();

    @Override
    void close();
}
