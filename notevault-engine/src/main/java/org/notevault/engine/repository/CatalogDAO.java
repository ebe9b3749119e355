package org.notevault.engine.repository;

import org.notevault.engine.entity.CatalogEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

public interface CatalogDAO {

    Mono<CatalogEntry> create(CatalogEntry entry);

    Mono<CatalogEntry> findActiveById(UUID id);

    Flux<CatalogEntry> findActiveByCourse(String courseCode);

    Flux<CatalogEntry> findAllActive();

    Flux<CatalogEntry> search(String query);

    Mono<Boolean> deactivate(UUID id);

    Mono<Long> countActiveByUploader(String uploader);

    Mono<Long> countActiveByFingerprint(String fingerprint);
}
