package org.notevault.engine.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.notevault.engine.entity.CatalogEntry;
import org.notevault.engine.exception.NotFoundException;
import org.notevault.engine.exception.ValidationException;
import org.notevault.engine.repository.CatalogDAO;
import org.notevault.engine.service.CatalogService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogServiceImpl implements CatalogService {

    private final CatalogDAO catalogDAO;
    private final Clock clock;

    @Override
    public Mono<CatalogEntry> register(String courseCode, String title, String uploader, String fingerprint) {
        CatalogEntry entry = CatalogEntry.builder()
                .id(UUID.randomUUID())
                .courseCode(courseCode.toUpperCase(Locale.ROOT))
                .title(title)
                .uploadedBy(uploader)
                .createdAt(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS))
                .fingerprint(fingerprint)
                .active(true)
                .build();
        return catalogDAO.create(entry)
                .doOnSuccess(created -> log.debug("Catalog entry {} registered for course {}", created.getId(), created.getCourseCode()));
    }

    @Override
    public Flux<CatalogEntry> list(String courseCode) {
        if (courseCode == null || courseCode.isBlank()) {
            return Flux.error(new ValidationException("Course code is required"));
        }
        return catalogDAO.findActiveByCourse(courseCode.strip().toUpperCase(Locale.ROOT));
    }

    @Override
    public Flux<CatalogEntry> listAll() {
        return catalogDAO.findAllActive();
    }

    @Override
    public Flux<CatalogEntry> search(String query) {
        if (query == null || query.isBlank()) {
            return Flux.error(new ValidationException("Search query must not be empty"));
        }
        return catalogDAO.search(query.strip());
    }

    @Override
    public Mono<String> resolve(UUID entryId) {
        return get(entryId).map(CatalogEntry::getFingerprint);
    }

    @Override
    public Mono<CatalogEntry> get(UUID entryId) {
        if (entryId == null) {
            return Mono.error(new ValidationException("Entry id is required"));
        }
        return catalogDAO.findActiveById(entryId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.entry(entryId)));
    }

    @Override
    public Mono<CatalogEntry> remove(UUID entryId) {
        return get(entryId)
                .flatMap(entry -> catalogDAO.deactivate(entryId)
                        .flatMap(deactivated -> deactivated
                                ? Mono.just(entry)
                                : Mono.error(NotFoundException.entry(entryId))))
                .doOnSuccess(entry -> log.info("Catalog entry {} removed", entryId));
    }

    @Override
    public Mono<Long> countActiveByUploader(String uploader) {
        return catalogDAO.countActiveByUploader(uploader);
    }

    @Override
    public Mono<Long> countActiveReferences(String fingerprint) {
        return catalogDAO.countActiveByFingerprint(fingerprint);
    }
}
