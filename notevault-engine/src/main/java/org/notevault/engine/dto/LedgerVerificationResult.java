package org.notevault.engine.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LedgerVerificationResult(
        LedgerVerificationStatus status,
        long totalEntries,
        long verifiedEntries,
        OffsetDateTime verifiedAt,
        BrokenLink brokenLink) {

    public enum LedgerVerificationStatus {
        VALID, BROKEN, EMPTY
    }

    public record BrokenLink(UUID entryId, long sequence, String expectedHash, String actualHash) {
    }
}
