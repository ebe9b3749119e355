package org.notevault.engine.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A watermarked copy delivered to one recipient. Only ever built after its ledger entry is durable.
 */
public record RenderedNote(
        UUID entryId,
        String fileName,
        byte[] content,
        String renderFingerprint,
        String markId,
        OffsetDateTime renderedAt,
        Long ledgerId) {
}
