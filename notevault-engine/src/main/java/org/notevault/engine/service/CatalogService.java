package org.notevault.engine.service;

import org.notevault.engine.entity.CatalogEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Course-indexed view over stored documents. Never reads or writes document bytes.
 */
public interface CatalogService {

    Mono<CatalogEntry> register(String courseCode, String title, String uploader, String fingerprint);

    /**
     * Active entries of one course, most recent first.
     */
    Flux<CatalogEntry> list(String courseCode);

    Flux<CatalogEntry> listAll();

    /**
     * Case-insensitive substring match on course code or title.
     */
    Flux<CatalogEntry> search(String query);

    Mono<String> resolve(UUID entryId);

    Mono<CatalogEntry> get(UUID entryId);

    /**
     * Soft delete. The entry disappears from every view but its downloads stay in the ledger.
     */
    Mono<CatalogEntry> remove(UUID entryId);

    Mono<Long> countActiveByUploader(String uploader);

    Mono<Long> countActiveReferences(String fingerprint);
}
