package org.notevault.engine.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DownloadStatistics(UUID entryId, long downloadCount, OffsetDateTime lastDownloadedAt) {
}
