package org.notevault.engine.dto;

public record UploadRequest(
        byte[] content,
        String originalFilename,
        String courseCode,
        String title,
        String uploader) {
}
