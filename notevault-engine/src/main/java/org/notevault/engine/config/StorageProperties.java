package org.notevault.engine.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Maps to notevault.storage.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "notevault.storage")
public class StorageProperties {

    private String basePath = "/tmp/notevault-storage";

    /**
     * Delete a blob once no active catalog entry references it any more.
     */
    private boolean purgeUnreferenced = false;

    /**
     * Staging files older than this are considered abandoned.
     */
    private Duration stagingMaxAge = Duration.ofHours(1);

    /**
     * Delay between two staging cleanups, in milliseconds.
     */
    private long cleanupInterval = 3600000L;

    @PostConstruct
    public void validate() {
        if (basePath == null || basePath.isBlank()) {
            throw new IllegalArgumentException("notevault.storage.base-path must not be empty");
        }
        if (stagingMaxAge == null || stagingMaxAge.isNegative() || stagingMaxAge.isZero()) {
            throw new IllegalArgumentException("notevault.storage.staging-max-age must be positive. Current value: " + stagingMaxAge);
        }
        if (cleanupInterval <= 0) {
            throw new IllegalArgumentException("notevault.storage.cleanup-interval must be positive. Current value: " + cleanupInterval);
        }
    }
}
