package org.notevault.engine.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.notevault.engine.dto.LedgerVerificationResult;
import org.notevault.engine.service.DownloadLedger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notevault.ledger.verification-enabled", havingValue = "true", matchIfMissing = true)
public class LedgerVerificationScheduler {

    private final DownloadLedger downloadLedger;

    @Scheduled(cron = "${notevault.ledger.verification-cron:0 0 3 * * ?}")
    public void verifyLedger() {
        log.info("Starting scheduled download ledger verification");
        downloadLedger.verifyAll()
                .doOnNext(result -> {
                    switch (result.status()) {
                        case VALID -> log.info("Download ledger verification passed: {} of {} entries verified",
                                result.verifiedEntries(), result.totalEntries());
                        case BROKEN -> {
                            LedgerVerificationResult.BrokenLink link = result.brokenLink();
                            log.warn("DOWNLOAD LEDGER INTEGRITY VIOLATION: chain of entry {} broken at sequence {}. Expected hash: {}, actual: {}",
                                    link.entryId(), link.sequence(), link.expectedHash(), link.actualHash());
                        }
                        case EMPTY -> log.info("Download ledger verification: no downloads recorded yet");
                    }
                })
                .doOnError(e -> log.error("Download ledger verification failed: {}", e.getMessage()))
                .subscribe();
    }
}
