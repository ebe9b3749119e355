package org.notevault.engine.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.notevault.engine.config.StorageProperties;
import org.notevault.engine.service.ContentStore;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes staging files that interrupted uploads left in the content store.
 * The interval is configured via notevault.storage.cleanup-interval (ms).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StagingCleanupScheduler {

    private final ContentStore contentStore;
    private final StorageProperties storageProperties;

    @Scheduled(fixedDelayString = "${notevault.storage.cleanup-interval:3600000}")
    public void cleanupStaging() {
        log.debug("Running content store staging cleanup");
        contentStore.cleanupStaging(storageProperties.getStagingMaxAge())
                .doOnSuccess(count -> {
                    if (count != null && count > 0) {
                        log.info("Staging cleanup completed: {} abandoned files removed", count);
                    } else {
                        log.debug("Staging cleanup completed: nothing to remove");
                    }
                })
                .doOnError(e -> log.error("Error during staging cleanup", e))
                .subscribe();
    }
}
