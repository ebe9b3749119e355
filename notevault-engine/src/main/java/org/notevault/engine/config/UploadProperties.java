package org.notevault.engine.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Limits applied to uploads before anything is written.
 * Maps to notevault.upload.* properties in application.yml
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "notevault.upload")
public class UploadProperties {

    public static final int MAX_IDENTITY_LENGTH = 100;
    private static final int MAX_COLUMN_LENGTH = 255;

    /**
     * Maximum size of an uploaded document in megabytes (MB), between 1 and 100.
     */
    private Integer maxFileSize = 10;

    /**
     * Maximum number of active notes per uploader.
     * - If 0: no limit
     * - If > 0: uploads beyond this count are rejected
     */
    private Integer maxNotesPerUploader = 100;

    private String courseCodePattern = "^[A-Z]{2,5}[0-9]{3,4}[A-Z]?$";

    private Integer titleMaxLength = 100;

    /**
     * Longest accepted uploader identity, at most 100 (the width of the uploaded_by columns).
     */
    private Integer uploaderMaxLength = MAX_IDENTITY_LENGTH;

    /**
     * Longest accepted original file name, at most 255.
     */
    private Integer filenameMaxLength = MAX_COLUMN_LENGTH;

    private Pattern compiledCourseCodePattern;

    @PostConstruct
    public void validate() {
        if (maxFileSize == null || maxFileSize < 1 || maxFileSize > 100) {
            throw new IllegalArgumentException(
                    "notevault.upload.max-file-size must be between 1 and 100 MB. Current value: " + maxFileSize);
        }
        if (maxNotesPerUploader == null || maxNotesPerUploader < 0) {
            throw new IllegalArgumentException(
                    "notevault.upload.max-notes-per-uploader must be >= 0 (0 means no limit). Current value: " + maxNotesPerUploader);
        }
        if (titleMaxLength == null || titleMaxLength < 1 || titleMaxLength > MAX_COLUMN_LENGTH) {
            throw new IllegalArgumentException(
                    "notevault.upload.title-max-length must be between 1 and " + MAX_COLUMN_LENGTH + ". Current value: " + titleMaxLength);
        }
        if (uploaderMaxLength == null || uploaderMaxLength < 1 || uploaderMaxLength > MAX_IDENTITY_LENGTH) {
            throw new IllegalArgumentException(
                    "notevault.upload.uploader-max-length must be between 1 and " + MAX_IDENTITY_LENGTH + ". Current value: " + uploaderMaxLength);
        }
        if (filenameMaxLength == null || filenameMaxLength < 1 || filenameMaxLength > MAX_COLUMN_LENGTH) {
            throw new IllegalArgumentException(
                    "notevault.upload.filename-max-length must be between 1 and " + MAX_COLUMN_LENGTH + ". Current value: " + filenameMaxLength);
        }
        try {
            compiledCourseCodePattern = Pattern.compile(courseCodePattern);
        } catch (PatternSyntaxException | NullPointerException e) {
            throw new IllegalArgumentException(
                    "notevault.upload.course-code-pattern is not a valid regular expression: " + courseCodePattern, e);
        }

        log.info("Upload limits: {} MB per file, {} notes per uploader", maxFileSize,
                maxNotesPerUploader == 0 ? "unlimited" : maxNotesPerUploader);
    }

    public long getMaxFileSizeInBytes() {
        return maxFileSize * 1024L * 1024L;
    }

    public boolean isUploaderQuotaEnabled() {
        return maxNotesPerUploader != null && maxNotesPerUploader > 0;
    }

    public Pattern getCompiledCourseCodePattern() {
        if (compiledCourseCodePattern == null) {
            compiledCourseCodePattern = Pattern.compile(courseCodePattern);
        }
        return compiledCourseCodePattern;
    }
}
