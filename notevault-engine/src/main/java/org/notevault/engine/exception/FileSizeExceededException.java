package org.notevault.engine.exception;

/**
 * Exception thrown when an uploaded file exceeds the configured size limit.
 */
public class FileSizeExceededException extends ValidationException {

    public FileSizeExceededException(String filename, long fileSize, long maxSize) {
        super(String.format("File '%s' exceeds the maximum allowed size. File size: %d bytes, Maximum allowed: %d MB",
                filename, fileSize, maxSize / (1024 * 1024)));
    }
}
