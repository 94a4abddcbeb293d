package com.eyelevel.archiveunzipper.service.storage;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;

/**
 * Opens an {@link ObjectStore} for a service endpoint.
 */
public interface ObjectStoreFactory {

    ObjectStore open(String serviceUrl, AwsCredentialsProvider credentials);
}
