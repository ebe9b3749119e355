package org.notevault.engine.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.notevault.engine.config.UploadProperties;
import org.notevault.engine.dto.UploadRequest;
import org.notevault.engine.exception.FileSizeExceededException;
import org.notevault.engine.exception.UploaderQuotaExceededException;
import org.notevault.engine.exception.ValidationException;
import org.notevault.engine.repository.CatalogDAO;
import org.notevault.engine.support.TestPdfs;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UploadValidatorTest {

    @Mock private CatalogDAO catalogDAO;

    private UploadProperties uploadProperties;
    private UploadValidator validator;
    private byte[] pdf;

    @BeforeEach
    void setUp() {
        uploadProperties = new UploadProperties();
        uploadProperties.validate();
        validator = new UploadValidator(uploadProperties, catalogDAO);
        pdf = TestPdfs.pdf("page one", "page two", "page three");
    }

    @Test
    void validate_validPdf_normalizesAndCountsPages() {
        when(catalogDAO.countActiveByUploader("alice")).thenReturn(Mono.just(0L));

        StepVerifier.create(validator.validate(new UploadRequest(pdf, " calc.pdf ", "cs101", "  Week 1 ", "alice")))
                .assertNext(upload -> {
                    assertEquals("CS101", upload.courseCode());
                    assertEquals("Week 1", upload.title());
                    assertEquals("calc.pdf", upload.originalFilename());
                    assertEquals(3, upload.pageCount());
                    assertEquals("application/pdf", upload.contentType());
                })
                .verifyComplete();
    }

    @Test
    void validate_tooLarge_failsWithFileSizeExceeded() {
        uploadProperties.setMaxFileSize(1);
        byte[] big = new byte[1024 * 1024 + 1];

        StepVerifier.create(validator.validate(new UploadRequest(big, "big.pdf", "CS101", "Big", "alice")))
                .expectError(FileSizeExceededException.class)
                .verify();
        verifyNoInteractions(catalogDAO);
    }

    @Test
    void validate_notAPdf_failsWithValidation() {
        when(catalogDAO.countActiveByUploader(anyString())).thenReturn(Mono.just(0L));
        byte[] text = "just some text".getBytes(StandardCharsets.UTF_8);

        StepVerifier.create(validator.validate(new UploadRequest(text, "notes.pdf", "CS101", "Notes", "alice")))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void validate_encryptedPdf_failsWithValidation() {
        when(catalogDAO.countActiveByUploader(anyString())).thenReturn(Mono.just(0L));

        StepVerifier.create(validator.validate(new UploadRequest(TestPdfs.encryptedPdf(), "locked.pdf", "CS101", "Locked", "alice")))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ValidationException.class, e);
                    assertTrue(e.getMessage().contains("not supported") || e.getMessage().contains("PDF"));
                })
                .verify();
    }

    @Test
    void validate_invalidCourseCode_failsWithValidation() {
        StepVerifier.create(validator.validate(new UploadRequest(pdf, "a.pdf", "Intro to CS", "Notes", "alice")))
                .expectErrorMatches(e -> e instanceof ValidationException && e.getMessage().contains("course code"))
                .verify();
    }

    @Test
    void validate_blankTitle_failsWithValidation() {
        StepVerifier.create(validator.validate(new UploadRequest(pdf, "a.pdf", "CS101", "   ", "alice")))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void validate_titleTooLong_failsWithValidation() {
        String title = "x".repeat(uploadProperties.getTitleMaxLength() + 1);

        StepVerifier.create(validator.validate(new UploadRequest(pdf, "a.pdf", "CS101", title, "alice")))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void validate_missingUploader_failsWithValidation() {
        StepVerifier.create(validator.validate(new UploadRequest(pdf, "a.pdf", "CS101", "Notes", null)))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void validate_uploaderTooLong_failsBeforeQuotaLookup() {
        String uploader = "u".repeat(101);

        StepVerifier.create(validator.validate(new UploadRequest(pdf, "a.pdf", "CS101", "Notes", uploader)))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ValidationException.class, e);
                    assertTrue(e.getMessage().contains("100"));
                })
                .verify();
        verifyNoInteractions(catalogDAO);
    }

    @Test
    void validate_uploaderAtLimit_isAccepted() {
        String uploader = "u".repeat(100);
        when(catalogDAO.countActiveByUploader(uploader)).thenReturn(Mono.just(0L));

        StepVerifier.create(validator.validate(new UploadRequest(pdf, "a.pdf", "CS101", "Notes", uploader)))
                .assertNext(upload -> assertEquals(uploader, upload.uploader()))
                .verifyComplete();
    }

    @Test
    void validate_fileNameTooLong_failsWithValidation() {
        String fileName = "n".repeat(252) + ".pdf";

        StepVerifier.create(validator.validate(new UploadRequest(pdf, fileName, "CS101", "Notes", "alice")))
                .expectError(ValidationException.class)
                .verify();
        verifyNoInteractions(catalogDAO);
    }

    @Test
    void validate_emptyContent_failsWithValidation() {
        StepVerifier.create(validator.validate(new UploadRequest(new byte[0], "a.pdf", "CS101", "Notes", "alice")))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void validate_uploaderAtQuota_failsWithQuotaExceeded() {
        uploadProperties.setMaxNotesPerUploader(2);
        when(catalogDAO.countActiveByUploader("alice")).thenReturn(Mono.just(2L));

        StepVerifier.create(validator.validate(new UploadRequest(pdf, "a.pdf", "CS101", "Notes", "alice")))
                .expectError(UploaderQuotaExceededException.class)
                .verify();
    }

    @Test
    void validate_quotaDisabled_skipsCount() {
        uploadProperties.setMaxNotesPerUploader(0);

        StepVerifier.create(validator.validate(new UploadRequest(pdf, "a.pdf", "CS101", "Notes", "alice")))
                .expectNextCount(1)
                .verifyComplete();
        verifyNoInteractions(catalogDAO);
    }

    @Test
    void validate_nullRequest_failsWithValidation() {
        StepVerifier.create(validator.validate(null))
                .expectError(ValidationException.class)
                .verify();
    }
}
