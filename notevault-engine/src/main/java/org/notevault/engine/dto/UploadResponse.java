package org.notevault.engine.dto;

import java.util.UUID;

/**
 * @param deduplicated true when identical bytes were already stored by an earlier upload
 */
public record UploadResponse(UUID entryId, String fingerprint, long size, int pageCount, boolean deduplicated) {
}
