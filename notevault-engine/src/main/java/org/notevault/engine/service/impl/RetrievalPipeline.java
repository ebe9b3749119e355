package org.notevault.engine.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.notevault.engine.config.UploadProperties;
import org.notevault.engine.dto.RenderedDocument;
import org.notevault.engine.dto.RenderedNote;
import org.notevault.engine.entity.CatalogEntry;
import org.notevault.engine.entity.LedgerEntry;
import org.notevault.engine.enums.RetrievalState;
import org.notevault.engine.exception.AbstractNoteVaultException;
import org.notevault.engine.exception.RetrievalFailedException;
import org.notevault.engine.exception.ValidationException;
import org.notevault.engine.service.CatalogService;
import org.notevault.engine.service.ContentStore;
import org.notevault.engine.service.DownloadLedger;
import org.notevault.engine.service.WatermarkRenderer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Drives one retrieval through {@code REQUESTED -> RESOLVED -> FETCHED -> RENDERED -> LOGGED -> DELIVERED}.
 * <p>
 * Any failure moves the request to {@code FAILED} and surfaces as a {@link RetrievalFailedException}
 * carrying the last state reached. Rendered bytes only leave this class after their ledger entry is durable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalPipeline {

    private static final String WATERMARKED_SUFFIX = "_watermarked.pdf";
    private static final int MAX_FILE_NAME_PART = 60;

    private final CatalogService catalogService;
    private final ContentStore contentStore;
    private final WatermarkRenderer watermarkRenderer;
    private final DownloadLedger downloadLedger;
    private final Clock clock;

    public Mono<RenderedNote> retrieve(UUID entryId, String requester) {
        return Mono.defer(() -> {
            Retrieval retrieval = new Retrieval(entryId, requester);
            log.debug("Retrieval of {} requested by {}", entryId, requester);
            return resolve(retrieval)
                    .flatMap(this::fetch)
                    .flatMap(this::render)
                    .flatMap(this::recordDownload)
                    .map(this::deliver)
                    .onErrorMap(e -> fail(retrieval, e));
        });
    }

    private Mono<Retrieval> resolve(Retrieval retrieval) {
        if (retrieval.requester == null || retrieval.requester.isBlank()) {
            return Mono.error(new ValidationException("Requester identity is required"));
        }
        if (retrieval.requester.length() > UploadProperties.MAX_IDENTITY_LENGTH) {
            return Mono.error(new ValidationException(
                    "Requester identity exceeds " + UploadProperties.MAX_IDENTITY_LENGTH + " characters"));
        }
        return catalogService.get(retrieval.entryId)
                .map(entry -> {
                    retrieval.entry = entry;
                    return retrieval.advance(RetrievalState.RESOLVED);
                });
    }

    private Mono<Retrieval> fetch(Retrieval retrieval) {
        return contentStore.get(retrieval.entry.getFingerprint())
                .map(content -> {
                    retrieval.original = content;
                    return retrieval.advance(RetrievalState.FETCHED);
                });
    }

    private Mono<Retrieval> render(Retrieval retrieval) {
        return Mono.fromCallable(() -> {
                    OffsetDateTime renderedAt = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC)
                            .truncatedTo(ChronoUnit.MILLIS);
                    retrieval.rendered = watermarkRenderer.render(retrieval.original, retrieval.requester, renderedAt);
                    retrieval.original = null;
                    return retrieval.advance(RetrievalState.RENDERED);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Retrieval> recordDownload(Retrieval retrieval) {
        RenderedDocument rendered = retrieval.rendered;
        return downloadLedger.record(retrieval.requester, retrieval.entryId, rendered.mark().documentFingerprint(),
                        rendered.mark().timestamp(), rendered.renderFingerprint(), rendered.mark().markId())
                .map(ledgerEntry -> {
                    retrieval.ledgerEntry = ledgerEntry;
                    return retrieval.advance(RetrievalState.LOGGED);
                });
    }

    private RenderedNote deliver(Retrieval retrieval) {
        RenderedDocument rendered = retrieval.rendered;
        LedgerEntry ledgerEntry = retrieval.ledgerEntry;
        retrieval.advance(RetrievalState.DELIVERED);
        log.info("Delivered entry {} to {} (render {}, ledger id {})",
                retrieval.entryId, retrieval.requester, rendered.renderFingerprint(), ledgerEntry.id());
        return new RenderedNote(retrieval.entryId, fileName(retrieval.entry), rendered.content(),
                rendered.renderFingerprint(), rendered.mark().markId(), rendered.mark().timestamp(), ledgerEntry.id());
    }

    private Throwable fail(Retrieval retrieval, Throwable cause) {
        RetrievalState failedAt = retrieval.state;
        retrieval.state = RetrievalState.FAILED;
        retrieval.rendered = null;
        if (cause instanceof AbstractNoteVaultException noteVaultException) {
            log.warn("Retrieval of {} by {} failed after {} [{}]: {}", retrieval.entryId, retrieval.requester,
                    failedAt, noteVaultException.getError(), cause.getMessage());
        } else {
            log.error("Retrieval of {} by {} failed after {}", retrieval.entryId, retrieval.requester, failedAt, cause);
        }
        return new RetrievalFailedException(retrieval.entryId, failedAt, cause);
    }

    static String fileName(CatalogEntry entry) {
        String base = sanitize(entry.getCourseCode()) + "-" + sanitize(entry.getTitle());
        return base + WATERMARKED_SUFFIX;
    }

    private static String sanitize(String value) {
        String cleaned = value == null ? "" : value.strip()
                .replaceAll("[^A-Za-z0-9._-]+", "_")
                .replaceAll("^[._]+|_+$", "");
        if (cleaned.isEmpty()) {
            cleaned = "note";
        }
        return cleaned.length() > MAX_FILE_NAME_PART ? cleaned.substring(0, MAX_FILE_NAME_PART) : cleaned;
    }

    private static final class Retrieval {

        private final UUID entryId;
        private final String requester;
        private RetrievalState state = RetrievalState.REQUESTED;
        private CatalogEntry entry;
        private byte[] original;
        private RenderedDocument rendered;
        private LedgerEntry ledgerEntry;

        private Retrieval(UUID entryId, String requester) {
            this.entryId = entryId;
            this.requester = requester;
        }

        private Retrieval advance(RetrievalState next) {
            log.debug("Retrieval of {} by {}: {} -> {}", entryId, requester, state, next);
            state = next;
            return this;
        }
    }
}
