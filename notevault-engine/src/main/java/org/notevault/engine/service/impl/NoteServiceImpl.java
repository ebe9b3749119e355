package org.notevault.engine.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.notevault.engine.config.StorageProperties;
import org.notevault.engine.dto.DownloadStatistics;
import org.notevault.engine.dto.LedgerVerificationResult;
import org.notevault.engine.dto.RenderedNote;
import org.notevault.engine.dto.UploadRequest;
import org.notevault.engine.dto.UploadResponse;
import org.notevault.engine.dto.ValidatedUpload;
import org.notevault.engine.entity.CatalogEntry;
import org.notevault.engine.entity.LedgerEntry;
import org.notevault.engine.entity.StoredDocument;
import org.notevault.engine.exception.NotFoundException;
import org.notevault.engine.exception.ValidationException;
import org.notevault.engine.repository.DocumentDAO;
import org.notevault.engine.service.CatalogService;
import org.notevault.engine.service.ContentStore;
import org.notevault.engine.service.DownloadLedger;
import org.notevault.engine.service.NoteService;
import org.notevault.engine.service.WatermarkRenderer;
import org.notevault.engine.utils.FingerprintUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class NoteServiceImpl implements NoteService {

    private static final int MAX_RECENT_DOWNLOADS = 500;

    private final UploadValidator uploadValidator;
    private final ContentStore contentStore;
    private final DocumentDAO documentDAO;
    private final CatalogService catalogService;
    private final FingerprintLocks fingerprintLocks;
    private final RetrievalPipeline retrievalPipeline;
    private final DownloadLedger downloadLedger;
    private final WatermarkRenderer watermarkRenderer;
    private final StorageProperties storageProperties;
    private final Clock clock;

    @Override
    public Mono<UploadResponse> upload(UploadRequest request) {
        return uploadValidator.validate(request)
                .flatMap(this::store);
    }

    private Mono<UploadResponse> store(ValidatedUpload upload) {
        String fingerprint = FingerprintUtils.sha256(upload.content());
        return fingerprintLocks.withLock(fingerprint, () -> contentStore.exists(fingerprint)
                        .flatMap(alreadyStored -> contentStore.put(upload.content())
                                .flatMap(stored -> documentDAO.create(StoredDocument.builder()
                                        .fingerprint(stored)
                                        .size((long) upload.content().length)
                                        .pageCount(upload.pageCount())
                                        .contentType(upload.contentType())
                                        .originalFilename(upload.originalFilename())
                                        .uploadedBy(upload.uploader())
                                        .uploadedAt(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS))
                                        .build()))
                                .flatMap(created -> catalogService.register(upload.courseCode(), upload.title(), upload.uploader(), fingerprint))
                                .map(entry -> new UploadResponse(entry.getId(), fingerprint, upload.content().length,
                                        upload.pageCount(), alreadyStored))))
                .doOnSuccess(response -> log.info("Upload by {} registered as entry {} for {} (document {}{})",
                        upload.uploader(), response.entryId(), upload.courseCode(), response.fingerprint(),
                        response.deduplicated() ? ", deduplicated" : ""))
                .doOnError(e -> log.error("Upload by {} failed after validation: {}", upload.uploader(), e.getMessage()));
    }

    @Override
    public Mono<RenderedNote> retrieve(UUID entryId, String requester) {
        return retrievalPipeline.retrieve(entryId, requester);
    }

    @Override
    public Flux<CatalogEntry> list(String courseCode) {
        return catalogService.list(courseCode);
    }

    @Override
    public Flux<CatalogEntry> listAll() {
        return catalogService.listAll();
    }

    @Override
    public Flux<CatalogEntry> search(String query) {
        return catalogService.search(query);
    }

    @Override
    public Flux<LedgerEntry> history(UUID entryId) {
        return downloadLedger.history(entryId);
    }

    @Override
    public Flux<LedgerEntry> historyByRecipient(String recipient) {
        if (recipient == null || recipient.isBlank()) {
            return Flux.error(new ValidationException("Recipient identity is required"));
        }
        return downloadLedger.historyByRecipient(recipient);
    }

    @Override
    public Flux<LedgerEntry> recentDownloads(int limit) {
        if (limit < 1 || limit > MAX_RECENT_DOWNLOADS) {
            return Flux.error(new ValidationException("Limit must be between 1 and " + MAX_RECENT_DOWNLOADS));
        }
        return downloadLedger.recent(limit);
    }

    @Override
    public Mono<DownloadStatistics> statistics(UUID entryId) {
        if (entryId == null) {
            return Mono.error(new ValidationException("Entry id is required"));
        }
        return downloadLedger.statistics(entryId);
    }

    @Override
    public Mono<LedgerEntry> trace(byte[] leakedCopy) {
        if (leakedCopy == null || leakedCopy.length == 0) {
            return Mono.error(new ValidationException("Copy to trace is empty"));
        }
        String fingerprint = FingerprintUtils.sha256(leakedCopy);
        return downloadLedger.findByRenderFingerprint(fingerprint)
                .onErrorResume(NotFoundException.class, e -> traceByEmbeddedMark(leakedCopy, fingerprint))
                .doOnSuccess(entry -> log.info("Copy {} traced to {} (entry {}, ledger id {})",
                        fingerprint, entry.recipient(), entry.entryId(), entry.id()));
    }

    private Mono<LedgerEntry> traceByEmbeddedMark(byte[] leakedCopy, String fingerprint) {
        log.debug("No render hashes to {}, reading embedded mark", fingerprint);
        return Mono.fromCallable(() -> watermarkRenderer.inspect(leakedCopy))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(mark -> mark
                        .map(m -> downloadLedger.findByRenderFingerprint(m.markId()))
                        .orElseGet(() -> Mono.error(NotFoundException.render(fingerprint))));
    }

    @Override
    public Mono<LedgerEntry> traceByFingerprint(String fingerprint) {
        String normalized = fingerprint == null ? null : fingerprint.strip().toLowerCase(Locale.ROOT);
        if (!FingerprintUtils.isFingerprint(normalized)) {
            return Mono.error(new ValidationException("Not a SHA-256 fingerprint: " + fingerprint));
        }
        return downloadLedger.findByRenderFingerprint(normalized);
    }

    @Override
    public Mono<CatalogEntry> remove(UUID entryId, String actor) {
        if (actor == null || actor.isBlank()) {
            return Mono.error(new ValidationException("Actor identity is required to remove an entry"));
        }
        return catalogService.remove(entryId)
                .flatMap(entry -> purgeIfUnreferenced(entry.getFingerprint()).thenReturn(entry))
                .doOnSuccess(entry -> log.info("Entry {} ({} - {}) removed by {}", entryId,
                        entry.getCourseCode(), entry.getTitle(), actor));
    }

    private Mono<Void> purgeIfUnreferenced(String fingerprint) {
        if (!storageProperties.isPurgeUnreferenced()) {
            return Mono.empty();
        }
        return fingerprintLocks.withLock(fingerprint, () -> catalogService.countActiveReferences(fingerprint)
                .filter(references -> references == 0)
                .flatMap(none -> contentStore.delete(fingerprint)
                        .doOnSuccess(v -> log.info("Purged unreferenced document {}", fingerprint))));
    }

    @Override
    public Mono<LedgerVerificationResult> verifyLedger() {
        return downloadLedger.verifyAll();
    }
}
