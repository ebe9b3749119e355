package org.notevault.engine.dto;

public record RenderedDocument(byte[] content, String renderFingerprint, WatermarkMark mark) {
}
