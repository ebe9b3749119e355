package org.notevault.engine.service;

import org.notevault.engine.dto.DownloadStatistics;
import org.notevault.engine.dto.LedgerVerificationResult;
import org.notevault.engine.entity.LedgerEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface DownloadLedger {

    /**
     * Appends one render event. The returned Mono completes only once the row is durable; any
     * persistence failure is reported as {@code LedgerUnavailableException}.
     */
    Mono<LedgerEntry> record(String recipient, UUID entryId, String documentFingerprint,
                             OffsetDateTime timestamp, String renderFingerprint, String markId);

    /**
     * Ordered by timestamp ascending, ties broken by ledger id ascending.
     */
    Flux<LedgerEntry> history(UUID entryId);

    /**
     * Matches either the hash of a rendered file or the mark id embedded in it.
     * Errors with {@code NotFoundException} when nothing matches.
     */
    Mono<LedgerEntry> findByRenderFingerprint(String fingerprint);

    Flux<LedgerEntry> historyByRecipient(String recipient);

    Flux<LedgerEntry> recent(int limit);

    Mono<DownloadStatistics> statistics(UUID entryId);

    Mono<LedgerVerificationResult> verifyChain(UUID entryId);

    Mono<LedgerVerificationResult> verifyAll();
}
