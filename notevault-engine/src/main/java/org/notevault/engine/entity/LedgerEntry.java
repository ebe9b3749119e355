package org.notevault.engine.entity;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One row of the download ledger. Immutable once written.
 */
public record LedgerEntry(
        Long id,
        UUID entryId,
        String recipient,
        String documentFingerprint,
        OffsetDateTime renderedAt,
        String renderFingerprint,
        String markId,
        long sequence,
        String previousHash,
        String hash) {
}
