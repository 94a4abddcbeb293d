package com.eyelevel.archiveunzipper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Set;

/**
 * Binds application properties under the "app.unzip" prefix to a strongly-typed
 * configuration object controlling how archives are extracted and announced.
 */
@Data
@ConfigurationProperties(prefix = "app.unzip")
public class UnzipProcessingConfig {

    /**
     * Upper bound for the source archive size. Zero or negative disables the check.
     */
    private long maxArchiveSizeBytes;

    /**
     * When enabled, OS metadata entries (macOS resource forks, thumbnail caches) are not extracted.
     */
    private boolean skipSystemEntries;

    private String transactionIdPrefix = "TRANS";

    private Set<String> systemEntryNames = Set.of("__MACOSX", ".DS_Store", "Thumbs.db");

    private RequestListener requestListener = new RequestListener();

    @Data
    public static class RequestListener {
        private boolean enabled;
        private int concurrencyLimit = 1;
        private int maxMessagesPerPoll = 1;
        private int pollTimeoutSeconds = 20;
    }
}
