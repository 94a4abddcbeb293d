package com.eyelevel.archiveunzipper.service.messaging;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;

public interface NotificationChannelFactory {

    NotificationChannel open(AwsCredentialsProvider credentials);
}
