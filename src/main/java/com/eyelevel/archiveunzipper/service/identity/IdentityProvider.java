package com.eyelevel.archiveunzipper.service.identity;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;

/**
 * Supplies the credentials used to talk to the object store and the messaging service.
 */
public interface IdentityProvider {

    /**
     * Acquires the credential for one pipeline run. Callers invoke this once per run and share the result
     * between every client the run builds.
     *
     * @return the credentials provider to hand to AWS SDK client builders.
     */
    AwsCredentialsProvider acquireCredential();
}
