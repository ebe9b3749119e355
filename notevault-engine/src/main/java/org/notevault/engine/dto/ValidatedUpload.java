package org.notevault.engine.dto;

/**
 * An upload that passed every check, with its course code normalized and its page count known.
 */
public record ValidatedUpload(
        byte[] content,
        String originalFilename,
        String courseCode,
        String title,
        String uploader,
        String contentType,
        int pageCount) {
}
