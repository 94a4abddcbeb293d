package com.eyelevel.archiveunzipper.service.identity;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

/**
 * Chooses the credential strategy based on the active Spring profile: static keys for the
 * "local" profile, the default AWS provider chain (environment, profile files, IAM role) otherwise.
 */
@Slf4j
@Component
public class AwsIdentityProvider implements IdentityProvider {

    private final Environment environment;
    private final String accessKey;
    private final String secretKey;

    public AwsIdentityProvider(final Environment environment,
                               @Value("${aws.access-key:}") final String accessKey,
                               @Value("${aws.secret-key:}") final String secretKey) {
        this.environment = environment;
        this.accessKey = accessKey;
        this.secretKey = secretKey;
    }

    @Override
    public AwsCredentialsProvider acquireCredential() {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.debug("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.debug("Non-local profile active. Using DefaultCredentialsProvider.");
        return DefaultCredentialsProvider.create();
    }
}
