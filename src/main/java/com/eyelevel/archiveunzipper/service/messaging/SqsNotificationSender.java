package com.eyelevel.archiveunzipper.service.messaging;

import com.eyelevel.archiveunzipper.common.async.Futures;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends messages to one SQS queue. The generated message id travels as the {@code MessageId} attribute;
 * on FIFO queues it is also the deduplication id and the group key becomes the message group id.
 */
@Slf4j
public class SqsNotificationSender implements NotificationSender {

    static final String MESSAGE_ID_ATTRIBUTE = "MessageId";
    private static final String STRING_DATA_TYPE = "String";
    private static final String FIFO_SUFFIX = ".fifo";

    private final SqsAsyncClient sqsAsyncClient;
    private final String queueUrl;
    private final boolean fifo;
    private volatile boolean closed;

    public SqsNotificationSender(final SqsAsyncClient sqsAsyncClient, final String queueUrl) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.queueUrl = queueUrl;
        this.fifo = queueUrl.endsWith(FIFO_SUFFIX);
    }

    @Override
    public void send(final OutboundMessage message) {
        if (closed) {
            throw new IllegalStateException("Sender for " + queueUrl + " is closed.");
        }

        final Map<String, MessageAttributeValue> attributes = new LinkedHashMap<>();
        message.attributes().forEach((name, value) -> attributes.put(name, stringAttribute(value)));
        attributes.put(MESSAGE_ID_ATTRIBUTE, stringAttribute(message.messageId()));

        final SendMessageRequest.Builder request = SendMessageRequest.builder()
                                                                     .queueUrl(queueUrl)
                                                                     .messageBody(message.body())
                                                                     .messageAttributes(attributes);
        if (fifo) {
            request.messageGroupId(message.groupKey()).messageDeduplicationId(message.messageId());
        }

        final SendMessageResponse response = Futures.await(sqsAsyncClient.sendMessage(request.build()));
        log.debug("Sent message {} to {} (SQS id {})", message.messageId(), queueUrl, response.messageId());
    }

    @Override
    public String destination() {
        return queueUrl;
    }

    @Override
    public void close() {
        closed = true;
        log.debug("Closed sender for {}", queueUrl);
    }

    private static MessageAttributeValue stringAttribute(final String value) {
        return MessageAttributeValue.builder().dataType(STRING_DATA_TYPE).stringValue(value).build();
    }
}
