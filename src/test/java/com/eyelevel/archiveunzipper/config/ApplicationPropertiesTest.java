package com.eyelevel.archiveunzipper.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ApplicationPropertiesTest {

    private StandardEnvironment environment;

    @BeforeEach
    void setUp() throws IOException {
        environment = new StandardEnvironment();
        environment.getPropertySources().remove(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME);
        environment.getPropertySources().remove(StandardEnvironment.SYSTEM_PROPERTIES_PROPERTY_SOURCE_NAME);
        for (PropertySource<?> source : new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yaml"))) {
            environment.getPropertySources().addLast(source);
        }
    }

    @Test
    void sqsListenerSupport_IsOffByDefault() {
        assertEquals("false", environment.getProperty("app.unzip.request-listener.enabled"));
        assertEquals("false", environment.getProperty("spring.cloud.aws.sqs.enabled"));
    }

    @Test
    void sqsListenerSupport_FollowsRequestListenerSwitch() {
        environment.getPropertySources().addFirst(new MapPropertySource("override",
                Map.of("app.unzip.request-listener.enabled", "true")));

        assertEquals("true", environment.getProperty("spring.cloud.aws.sqs.enabled"));
    }
}
