package com.eyelevel.archiveunzipper.service.messaging;

/**
 * A connection to the messaging service, owned by a single run.
 */
public interface NotificationChannel extends AutoCloseable {

    NotificationSender createSender(String topicName);

    @Override
    void close();
}
