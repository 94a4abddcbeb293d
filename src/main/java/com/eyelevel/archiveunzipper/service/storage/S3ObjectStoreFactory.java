package com.eyelevel.archiveunzipper.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;

import java.net.URI;

/**
 * Builds an {@link S3ObjectStore} for the endpoint named in a request. The client lives for one run
 * and is closed with the store.
 */
@Slf4j
@Component
public class S3ObjectStoreFactory implements ObjectStoreFactory {

    private final ClientOverrideConfiguration clientOverrideConfiguration;
    private final String awsRegion;
    private final boolean pathStyleAccess;

    public S3ObjectStoreFactory(final ClientOverrideConfiguration clientOverrideConfiguration,
                                @Value("${aws.region}") final String awsRegion,
                                @Value("${aws.s3.path-style-access-enabled:false}") final boolean pathStyleAccess) {
        this.clientOverrideConfiguration = clientOverrideConfiguration;
        this.awsRegion = awsRegion;
        this.pathStyleAccess = pathStyleAccess;
    }

    @Override
    public ObjectStore open(final String serviceUrl, final AwsCredentialsProvider credentials) {
        log.debug("Opening S3AsyncClient for endpoint {} in region {}", serviceUrl, awsRegion);
        final S3AsyncClient client = S3AsyncClient.builder()
                                                  .endpointOverride(URI.create(serviceUrl))
                                                  .region(Region.of(awsRegion))
                                                  .credentialsProvider(credentials)
                                                  .forcePathStyle(pathStyleAccess)
                                                  .overrideConfiguration(clientOverrideConfiguration)
                                                  .build();
        return new S3ObjectStore(client, serviceUrl);
    }
}
