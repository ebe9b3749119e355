package org.notevault.engine.service;

import org.notevault.engine.dto.DownloadStatistics;
import org.notevault.engine.dto.LedgerVerificationResult;
import org.notevault.engine.dto.RenderedNote;
import org.notevault.engine.dto.UploadRequest;
import org.notevault.engine.dto.UploadResponse;
import org.notevault.engine.entity.CatalogEntry;
import org.notevault.engine.entity.LedgerEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Entry point of the engine. Front-ends (chat bots, web handlers) authenticate users and call
 * this interface with the resulting identity.
 */
public interface NoteService {

    /**
     * Validates, stores and catalogs a document. Nothing is written when validation fails.
     */
    Mono<UploadResponse> upload(UploadRequest request);

    /**
     * Produces a copy watermarked for the requester. The copy is emitted only once its download
     * is recorded in the ledger.
     */
    Mono<RenderedNote> retrieve(UUID entryId, String requester);

    Flux<CatalogEntry> list(String courseCode);

    Flux<CatalogEntry> listAll();

    Flux<CatalogEntry> search(String query);

    Flux<LedgerEntry> history(UUID entryId);

    /**
     * Every copy rendered for one recipient, oldest first.
     */
    Flux<LedgerEntry> historyByRecipient(String recipient);

    /**
     * The latest downloads across all entries, newest first. {@code limit} is between 1 and 500.
     */
    Flux<LedgerEntry> recentDownloads(int limit);

    /**
     * Download count and last download of an entry, removed entries included.
     */
    Mono<DownloadStatistics> statistics(UUID entryId);

    /**
     * Finds who received a leaked copy, first by the hash of the file, then by the mark embedded in it.
     */
    Mono<LedgerEntry> trace(byte[] leakedCopy);

    Mono<LedgerEntry> traceByFingerprint(String fingerprint);

    Mono<CatalogEntry> remove(UUID entryId, String actor);

    Mono<LedgerVerificationResult> verifyLedger();
}
