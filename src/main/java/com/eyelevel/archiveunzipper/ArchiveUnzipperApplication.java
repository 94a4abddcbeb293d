package com.eyelevel.archiveunzipper;

import com.eyelevel.archiveunzipper.config.UnzipProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;

/**
 * The main entry point for the Archive Unzipper Spring Boot application.
 * <p>
 * The application exposes a single pipeline stage: a ZIP archive held in object storage is downloaded,
 * its file entries are uploaded to a destination location and one notification message per entry is sent
 * to a downstream queue.
 * <ul>
 *     <li>{@link SpringBootApplication}: enables auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.unzip" properties to {@link UnzipProcessingConfig}.</li>
 * </ul>
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = UnzipProcessingConfig.class)
public class ArchiveUnzipperApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("Starting ArchiveUnzipperApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(ArchiveUnzipperApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "ArchiveUnzipper"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
