package org.notevault.engine.repository;

import org.notevault.engine.dto.DownloadStatistics;
import org.notevault.engine.entity.LedgerEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Append-only access to the download ledger. There is deliberately no update or delete.
 */
public interface LedgerDAO {

    Mono<LedgerEntry> insert(LedgerEntry entry);

    Mono<LedgerEntry> findHead(UUID entryId);

    Flux<LedgerEntry> findByEntry(UUID entryId);

    Flux<LedgerEntry> findChain(UUID entryId);

    Flux<UUID> findEntryIds();

    Mono<LedgerEntry> findByRenderFingerprint(String fingerprint);

    Flux<LedgerEntry> findByRecipient(String recipient);

    Flux<LedgerEntry> findRecent(int limit);

    Mono<DownloadStatistics> statistics(UUID entryId);
}
