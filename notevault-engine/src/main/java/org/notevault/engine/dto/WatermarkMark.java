package org.notevault.engine.dto;

import java.time.OffsetDateTime;

/**
 * Machine-readable mark embedded in a rendered copy's document information.
 */
public record WatermarkMark(String recipient, OffsetDateTime timestamp, String markId, String documentFingerprint) {
}
