package com.eyelevel.archiveunzipper.service.messaging;

import com.eyelevel.archiveunzipper.common.async.Futures;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;

/**
 * A {@link NotificationChannel} over a dedicated {@link SqsAsyncClient}. Closing the channel closes the client.
 */
@Slf4j
public class SqsNotificationChannel implements NotificationChannel {

    private final SqsAsyncClient sqsAsyncClient;

    public SqsNotificationChannel(final SqsAsyncClient sqsAsyncClient) {
        this.sqsAsyncClient = sqsAsyncClient;
    }

    /**
     * Resolves the queue URL for {@code topicName} and binds a sender to it.
     */
    @Override
    public NotificationSender createSender(final String topicName) {
        final String queueUrl = Futures.await(
                sqsAsyncClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(topicName).build())).queueUrl();
        log.debug("Resolved queue '{}' to {}", topicName, queueUrl);
        return new SqsNotificationSender(sqsAsyncClient, queueUrl);
    }

    @Override
    public void close() {
        log.debug("Disposing SQS connection");
        sqsAsyncClient.close();
    }
}
