package org.notevault.engine.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.notevault.engine.config.LedgerProperties;
import org.notevault.engine.dto.DownloadStatistics;
import org.notevault.engine.dto.LedgerVerificationResult;
import org.notevault.engine.dto.LedgerVerificationResult.BrokenLink;
import org.notevault.engine.dto.LedgerVerificationResult.LedgerVerificationStatus;
import org.notevault.engine.entity.LedgerEntry;
import org.notevault.engine.exception.LedgerUnavailableException;
import org.notevault.engine.exception.NotFoundException;
import org.notevault.engine.repository.LedgerDAO;
import org.notevault.engine.service.DownloadLedger;
import org.notevault.engine.service.LedgerChainService;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadLedgerImpl implements DownloadLedger {

    private final LedgerDAO ledgerDAO;
    private final LedgerChainService ledgerChainService;
    private final LedgerProperties ledgerProperties;

    @Override
    public Mono<LedgerEntry> record(String recipient, UUID entryId, String documentFingerprint,
                                    OffsetDateTime timestamp, String renderFingerprint, String markId) {
        OffsetDateTime renderedAt = timestamp.withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
        int attempts = Math.max(ledgerProperties.getMaxAppendAttempts(), 1);
        return Mono.defer(() -> append(recipient, entryId, documentFingerprint, renderedAt, renderFingerprint, markId))
                .retryWhen(Retry.max(attempts - 1L)
                        .filter(DuplicateKeyException.class::isInstance)
                        .doBeforeRetry(signal -> log.debug("Ledger position for entry {} taken concurrently, re-reading chain head (attempt {})",
                                entryId, signal.totalRetries() + 2)))
                .doOnSuccess(entry -> log.info("Ledger entry {} recorded: {} received entry {} at {}",
                        entry.id(), recipient, entryId, renderedAt))
                .onErrorMap(e -> !(e instanceof LedgerUnavailableException), e -> {
                    log.error("Failed to record ledger entry for {} on entry {}: {}", recipient, entryId, e.getMessage());
                    return new LedgerUnavailableException("Download ledger could not record the retrieval of " + entryId, e);
                });
    }

    private Mono<LedgerEntry> append(String recipient, UUID entryId, String documentFingerprint,
                                     OffsetDateTime renderedAt, String renderFingerprint, String markId) {
        return ledgerDAO.findHead(entryId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(head -> {
                    long sequence = head.map(h -> h.sequence() + 1).orElse(1L);
                    String previousHash = head.map(LedgerEntry::hash)
                            .orElseGet(() -> ledgerChainService.computeGenesisHash(entryId));
                    String hash = ledgerChainService.computeHash(entryId, sequence, recipient, documentFingerprint,
                            renderedAt, renderFingerprint, markId, previousHash);
                    return ledgerDAO.insert(new LedgerEntry(null, entryId, recipient, documentFingerprint,
                            renderedAt, renderFingerprint, markId, sequence, previousHash, hash));
                });
    }

    @Override
    public Flux<LedgerEntry> history(UUID entryId) {
        return ledgerDAO.findByEntry(entryId);
    }

    @Override
    public Mono<LedgerEntry> findByRenderFingerprint(String fingerprint) {
        return ledgerDAO.findByRenderFingerprint(fingerprint)
                .switchIfEmpty(Mono.error(() -> NotFoundException.render(fingerprint)));
    }

    @Override
    public Flux<LedgerEntry> historyByRecipient(String recipient) {
        return ledgerDAO.findByRecipient(recipient);
    }

    @Override
    public Flux<LedgerEntry> recent(int limit) {
        return ledgerDAO.findRecent(limit);
    }

    @Override
    public Mono<DownloadStatistics> statistics(UUID entryId) {
        return ledgerDAO.statistics(entryId)
                .defaultIfEmpty(new DownloadStatistics(entryId, 0, null));
    }

    @Override
    public Mono<LedgerVerificationResult> verifyChain(UUID entryId) {
        AtomicLong counter = new AtomicLong(0);
        AtomicReference<String> expectedPreviousHash = new AtomicReference<>(ledgerChainService.computeGenesisHash(entryId));
        AtomicReference<BrokenLink> brokenLinkRef = new AtomicReference<>();

        return ledgerDAO.findChain(entryId)
                .takeWhile(entry -> brokenLinkRef.get() == null)
                .doOnNext(entry -> {
                    long position = counter.incrementAndGet();

                    // a missing row shows up as a gap in the sequence
                    if (entry.sequence() != position) {
                        brokenLinkRef.set(new BrokenLink(entryId, position, String.valueOf(position), String.valueOf(entry.sequence())));
                        return;
                    }
                    if (!expectedPreviousHash.get().equals(entry.previousHash())) {
                        brokenLinkRef.set(new BrokenLink(entryId, position, expectedPreviousHash.get(), entry.previousHash()));
                        return;
                    }
                    String recomputedHash = ledgerChainService.computeHash(entry);
                    if (!recomputedHash.equals(entry.hash())) {
                        brokenLinkRef.set(new BrokenLink(entryId, position, recomputedHash, entry.hash()));
                        return;
                    }
                    expectedPreviousHash.set(entry.hash());
                })
                .then(Mono.fromCallable(() -> {
                    long total = counter.get();
                    BrokenLink brokenLink = brokenLinkRef.get();

                    if (total == 0) {
                        return new LedgerVerificationResult(LedgerVerificationStatus.EMPTY, 0, 0, OffsetDateTime.now(), null);
                    }
                    if (brokenLink != null) {
                        return new LedgerVerificationResult(LedgerVerificationStatus.BROKEN, total, brokenLink.sequence() - 1,
                                OffsetDateTime.now(), brokenLink);
                    }
                    return new LedgerVerificationResult(LedgerVerificationStatus.VALID, total, total, OffsetDateTime.now(), null);
                }));
    }

    @Override
    public Mono<LedgerVerificationResult> verifyAll() {
        return ledgerDAO.findEntryIds()
                .concatMap(this::verifyChain)
                .reduce(new LedgerVerificationResult(LedgerVerificationStatus.EMPTY, 0, 0, OffsetDateTime.now(), null),
                        DownloadLedgerImpl::combine);
    }

    private static LedgerVerificationResult combine(LedgerVerificationResult acc, LedgerVerificationResult next) {
        long total = acc.totalEntries() + next.totalEntries();
        long verified = acc.verifiedEntries() + next.verifiedEntries();
        BrokenLink brokenLink = acc.brokenLink() != null ? acc.brokenLink() : next.brokenLink();
        LedgerVerificationStatus status;
        if (brokenLink != null) {
            status = LedgerVerificationStatus.BROKEN;
        } else if (total == 0) {
            status = LedgerVerificationStatus.EMPTY;
        } else {
            status = LedgerVerificationStatus.VALID;
        }
        return new LedgerVerificationResult(status, total, verified, next.verifiedAt(), brokenLink);
    }
}
