package com.eyelevel.archiveunzipper.config;

import com.eyelevel.archiveunzipper.service.identity.IdentityProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClientBuilder;

import java.net.URI;

/**
 * Provides the shared AWS SDK configuration.
 * <p>
 * Object store and notification clients are built per run (their endpoints arrive with the request), so the
 * only long-lived client here is the SQS client backing the optional request listener.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.s3.retry-count}")
    private int retryCount;

    @Value("${aws.sqs.endpoint:}")
    private String sqsEndpoint;

    /**
     * Defines a shared ClientOverrideConfiguration with an Adaptive Retry Policy.
     * Used by every S3 and SQS client the application builds.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                     .numRetries(retryCount).build();

        return ClientOverrideConfiguration.builder().retryPolicy(adaptiveRetryPolicy).build();
    }

    /**
     * Creates the SQS async client used by the request listener container.
     */
    @Bean
    public SqsAsyncClient sqsAsyncClient(IdentityProvider identityProvider,
                                         ClientOverrideConfiguration clientOverrideConfig) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        SqsAsyncClientBuilder builder = SqsAsyncClient.builder().region(Region.of(awsRegion))
                                                      .credentialsProvider(identityProvider.acquireCredential())
                                                      .overrideConfiguration(clientOverrideConfig);
        if (StringUtils.hasText(sqsEndpoint)) {
            builder.endpointOverride(URI.create(sqsEndpoint));
        }
        return builder.build();
    }
}
