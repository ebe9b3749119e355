package org.notevault.engine.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.notevault.engine.config.UploadProperties;
import org.notevault.engine.dto.UploadRequest;
import org.notevault.engine.dto.ValidatedUpload;
import org.notevault.engine.exception.FileSizeExceededException;
import org.notevault.engine.exception.UnsupportedFormatException;
import org.notevault.engine.exception.UploaderQuotaExceededException;
import org.notevault.engine.exception.ValidationException;
import org.notevault.engine.repository.CatalogDAO;
import org.notevault.engine.utils.PdfSupport;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.Locale;

/**
 * Runs every upload check before the engine writes anything.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadValidator {

    private final UploadProperties uploadProperties;
    private final CatalogDAO catalogDAO;
    private final Tika tika = new Tika();

    public Mono<ValidatedUpload> validate(UploadRequest request) {
        if (request == null) {
            return Mono.error(new ValidationException("Upload request is required"));
        }
        return validateFields(request)
                .then(Mono.defer(() -> validateUploaderQuota(request.uploader())))
                .then(Mono.defer(() -> inspectContent(request)))
                .map(pageCount -> new ValidatedUpload(
                        request.content(),
                        request.originalFilename().strip(),
                        normalizeCourseCode(request.courseCode()),
                        request.title().strip(),
                        request.uploader().strip(),
                        PdfSupport.PDF_CONTENT_TYPE,
                        pageCount))
                .doOnError(ValidationException.class, e -> log.warn("Upload rejected: {}", e.getMessage()));
    }

    private Mono<Void> validateFields(UploadRequest request) {
        return Mono.fromRunnable(() -> {
            if (isBlank(request.uploader())) {
                throw new ValidationException("Uploader identity is required");
            }
            if (request.uploader().strip().length() > uploadProperties.getUploaderMaxLength()) {
                throw new ValidationException("Uploader identity exceeds " + uploadProperties.getUploaderMaxLength() + " characters");
            }
            if (isBlank(request.originalFilename())) {
                throw new ValidationException("File name is required");
            }
            if (request.originalFilename().strip().length() > uploadProperties.getFilenameMaxLength()) {
                throw new ValidationException("File name exceeds " + uploadProperties.getFilenameMaxLength() + " characters");
            }
            byte[] content = request.content();
            if (content == null || content.length == 0) {
                throw new ValidationException("File '" + request.originalFilename() + "' is empty");
            }
            long maxSize = uploadProperties.getMaxFileSizeInBytes();
            if (content.length > maxSize) {
                throw new FileSizeExceededException(request.originalFilename(), content.length, maxSize);
            }
            String courseCode = normalizeCourseCode(request.courseCode());
            if (courseCode == null || !uploadProperties.getCompiledCourseCodePattern().matcher(courseCode).matches()) {
                throw new ValidationException("Invalid course code: " + request.courseCode());
            }
            if (isBlank(request.title())) {
                throw new ValidationException("Title is required");
            }
            if (request.title().strip().length() > uploadProperties.getTitleMaxLength()) {
                throw new ValidationException("Title exceeds " + uploadProperties.getTitleMaxLength() + " characters");
            }
        });
    }

    private Mono<Void> validateUploaderQuota(String uploader) {
        if (!uploadProperties.isUploaderQuotaEnabled()) {
            return Mono.empty();
        }
        int maxNotes = uploadProperties.getMaxNotesPerUploader();
        return catalogDAO.countActiveByUploader(uploader.strip())
                .flatMap(activeNotes -> {
                    if (activeNotes >= maxNotes) {
                        return Mono.error(new UploaderQuotaExceededException(uploader, activeNotes, maxNotes));
                    }
                    return Mono.empty();
                });
    }

    private Mono<Integer> inspectContent(UploadRequest request) {
        return Mono.fromCallable(() -> {
                    String detected = tika.detect(request.content(), request.originalFilename());
                    if (!PdfSupport.PDF_CONTENT_TYPE.equals(detected)) {
                        throw new ValidationException("Only PDF documents are accepted, got " + detected);
                    }
                    try (PDDocument document = PdfSupport.load(request.content())) {
                        return document.getNumberOfPages();
                    } catch (UnsupportedFormatException e) {
                        throw new ValidationException(e.getMessage(), e);
                    } catch (IOException e) {
                        throw new ValidationException("Could not read PDF document: " + e.getMessage(), e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    static String normalizeCourseCode(String courseCode) {
        return courseCode == null ? null : courseCode.strip().toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
