package com.eyelevel.archiveunzipper.support;

import com.eyelevel.archiveunzipper.service.messaging.NotificationChannel;
import com.eyelevel.archiveunzipper.service.messaging.NotificationChannelFactory;
import com.eyelevel.archiveunzipper.service.messaging.NotificationSender;
import com.eyelevel.archiveunzipper.service.messaging.OutboundMessage;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * A notification channel that keeps sent messages in memory. Sends are appended to the shared event log as
 * {@code send:<UnzipBlobFullPath>}.
 */
public class RecordingNotificationChannel implements NotificationChannelFactory, NotificationChannel {

    private final List<String> events;
    private final List<OutboundMessage> sent = new ArrayList<>();
    private final RecordingSender sender = new RecordingSender();
    private int failOnSendNumber = -1;
    private boolean failOnCreateSender;
    private int opened;
    private int sendersCreated;
    private String topicName;
    private boolean closed;

    public RecordingNotificationChannel(List<String> events) {
        this.events = events;
    }

    /**
     * Makes the n-th send (1-indexed) fail.
     */
    public RecordingNotificationChannel failOnSend(int sendNumber) {
        this.failOnSendNumber = sendNumber;
        return this;
    }

    public RecordingNotificationChannel failOnCreateSender() {
        this.failOnCreateSender = true;
        return this;
    }

    public List<OutboundMessage> sent() {
        return sent;
    }

    public int opened() {
        return opened;
    }

    public int sendersCreated() {
        return sendersCreated;
    }

    public String topicName() {
        return topicName;
    }

    public boolean isSenderClosed() {
        return sender.closed;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public NotificationChannel open(AwsCredentialsProvider credentials) {
        opened++;
        return this;
    }

    @Override
    public NotificationSender createSender(String topicName) {
        if (failOnCreateSender) {
            throw new IllegalStateException("Queue " + topicName + " does not exist");
        }
        sendersCreated++;
        this.topicName = topicName;
        return sender;
    }

    @Override
    public void close() {
        closed = true;
    }

    private class RecordingSender implements NotificationSender {

        private boolean closed;

        @Override
        public void send(OutboundMessage message) {
            if (closed) {
                throw new IllegalStateException("sender closed");
            }
            if (sent.size() + 1 == failOnSendNumber) {
                throw new IllegalStateException("Simulated send failure");
            }
            sent.add(message);
            events.add("send:" + message.attributes().get("UnzipBlobFullPath"));
        }

        @Override
        public String destination() {
            return topicName;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
