package org.notevault.engine.repository.impl;

import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import org.notevault.engine.dto.DownloadStatistics;
import org.notevault.engine.entity.LedgerEntry;
import org.notevault.engine.repository.LedgerDAO;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class LedgerDAOImpl implements LedgerDAO {

    private static final String SELECT_LEDGER = "SELECT id, entry_id, recipient, document_fingerprint, rendered_at, render_fingerprint, mark_id, sequence_no, previous_hash, hash FROM download_ledger";
    private static final String BY_TIMESTAMP = " ORDER BY rendered_at ASC, id ASC";

    private final DatabaseClient databaseClient;

    /**
     * Single INSERT, so a failed append never leaves a partial row. A concurrent append that took
     * the same (entry_id, sequence_no) first makes this fail with a DuplicateKeyException.
     */
    @Override
    public Mono<LedgerEntry> insert(LedgerEntry entry) {
        return databaseClient.sql("INSERT INTO download_ledger (entry_id, recipient, document_fingerprint, rendered_at, render_fingerprint, mark_id, sequence_no, previous_hash, hash) " +
                        "VALUES (:entry, :recipient, :doc, :at, :render, :mark, :seq, :prev, :hash)")
                .bind("entry", entry.entryId())
                .bind("recipient", entry.recipient())
                .bind("doc", entry.documentFingerprint())
                .bind("at", entry.renderedAt())
                .bind("render", entry.renderFingerprint())
                .bind("mark", entry.markId())
                .bind("seq", entry.sequence())
                .bind("prev", entry.previousHash())
                .bind("hash", entry.hash())
                .then()
                .then(databaseClient.sql(SELECT_LEDGER + " WHERE entry_id = :entry AND sequence_no = :seq")
                        .bind("entry", entry.entryId())
                        .bind("seq", entry.sequence())
                        .map(LedgerDAOImpl::toLedgerEntry)
                        .one());
    }

    @Override
    public Mono<LedgerEntry> findHead(UUID entryId) {
        return databaseClient.sql(SELECT_LEDGER + " WHERE entry_id = :entry ORDER BY sequence_no DESC LIMIT 1")
                .bind("entry", entryId)
                .map(LedgerDAOImpl::toLedgerEntry)
                .one();
    }

    @Override
    public Flux<LedgerEntry> findByEntry(UUID entryId) {
        return databaseClient.sql(SELECT_LEDGER + " WHERE entry_id = :entry" + BY_TIMESTAMP)
                .bind("entry", entryId)
                .map(LedgerDAOImpl::toLedgerEntry)
                .all();
    }

    @Override
    public Flux<LedgerEntry> findChain(UUID entryId) {
        return databaseClient.sql(SELECT_LEDGER + " WHERE entry_id = :entry ORDER BY sequence_no ASC")
                .bind("entry", entryId)
                .map(LedgerDAOImpl::toLedgerEntry)
                .all();
    }

    @Override
    public Flux<UUID> findEntryIds() {
        return databaseClient.sql("SELECT DISTINCT entry_id FROM download_ledger ORDER BY entry_id")
                .map(row -> row.get("entry_id", UUID.class))
                .all();
    }

    @Override
    public Mono<LedgerEntry> findByRenderFingerprint(String fingerprint) {
        return databaseClient.sql(SELECT_LEDGER + " WHERE render_fingerprint = :render OR mark_id = :mark ORDER BY id ASC LIMIT 1")
                .bind("render", fingerprint)
                .bind("mark", fingerprint)
                .map(LedgerDAOImpl::toLedgerEntry)
                .one();
    }

    @Override
    public Flux<LedgerEntry> findByRecipient(String recipient) {
        return databaseClient.sql(SELECT_LEDGER + " WHERE recipient = :recipient" + BY_TIMESTAMP)
                .bind("recipient", recipient)
                .map(LedgerDAOImpl::toLedgerEntry)
                .all();
    }

    @Override
    public Flux<LedgerEntry> findRecent(int limit) {
        return databaseClient.sql(SELECT_LEDGER + " ORDER BY rendered_at DESC, id DESC LIMIT " + Math.max(limit, 0))
                .map(LedgerDAOImpl::toLedgerEntry)
                .all();
    }

    @Override
    public Mono<DownloadStatistics> statistics(UUID entryId) {
        return databaseClient.sql("SELECT COUNT(*) AS cnt, MAX(rendered_at) AS last_at FROM download_ledger WHERE entry_id = :entry")
                .bind("entry", entryId)
                .map(row -> new DownloadStatistics(
                        entryId,
                        row.get("cnt", Long.class),
                        row.get("last_at", OffsetDateTime.class)))
                .one();
    }

    private static LedgerEntry toLedgerEntry(Readable row) {
        return new LedgerEntry(
                row.get("id", Long.class),
                row.get("entry_id", UUID.class),
                row.get("recipient", String.class),
                row.get("document_fingerprint", String.class),
                row.get("rendered_at", OffsetDateTime.class),
                row.get("render_fingerprint", String.class),
                row.get("mark_id", String.class),
                row.get("sequence_no", Long.class),
                row.get("previous_hash", String.class),
                row.get("hash", String.class));
    }
}
