package com.eyelevel.archiveunzipper.service.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClientBuilder;

import java.net.URI;

/**
 * Opens an SQS connection with the run's credential.
 */
@Slf4j
@Component
public class SqsNotificationChannelFactory implements NotificationChannelFactory {

    private final ClientOverrideConfiguration clientOverrideConfiguration;
    private final String awsRegion;
    private final String sqsEndpoint;

    public SqsNotificationChannelFactory(final ClientOverrideConfiguration clientOverrideConfiguration,
                                         @Value("${aws.region}") final String awsRegion,
                                         @Value("${aws.sqs.endpoint:}") final String sqsEndpoint) {
        this.clientOverrideConfiguration = clientOverrideConfiguration;
        this.awsRegion = awsRegion;
        this.sqsEndpoint = sqsEndpoint;
    }

    @Override
    public NotificationChannel open(final AwsCredentialsProvider credentials) {
        log.debug("Opening SqsAsyncClient for region {}", awsRegion);
        final SqsAsyncClientBuilder builder = SqsAsyncClient.builder()
                                                            .region(Region.of(awsRegion))
                                                            .credentialsProvider(credentials)
                                                            .overrideConfiguration(clientOverrideConfiguration);
        if (StringUtils.hasText(sqsEndpoint)) {
            builder.endpointOverride(URI.create(sqsEndpoint));
        }
        return new SqsNotificationChannel(builder.build());
    }
}
