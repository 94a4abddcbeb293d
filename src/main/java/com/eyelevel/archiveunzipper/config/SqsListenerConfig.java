package com.eyelevel.archiveunzipper.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(prefix = "app.unzip.request-listener", name = "enabled", havingValue = "true")
public class SqsListenerConfig {

    /**
     * Creates the container factory for the unzip request listener.
     * Settings come from the 'app.unzip.request-listener' properties.
     */
    @Bean("unzipRequestContainerFactory")
    public SqsMessageListenerContainerFactory<Object> unzipRequestContainerFactory(SqsAsyncClient sqsAsyncClient,
                                                                                   UnzipProcessingConfig config) {
        UnzipProcessingConfig.RequestListener listener = config.getRequestListener();

        SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);
        // Runs never throw, so every message is acknowledged once the pipeline returns.
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                                            .maxConcurrentMessages(listener.getConcurrencyLimit())
                                            .maxMessagesPerPoll(listener.getMaxMessagesPerPoll())
                                            .pollTimeout(Duration.ofSeconds(listener.getPollTimeoutSeconds())));
        return factory;
    }
}
