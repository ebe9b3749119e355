package org.notevault.engine.repository.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.notevault.engine.entity.StoredDocument;
import org.notevault.engine.support.TestDatabase;
import org.notevault.engine.utils.FingerprintUtils;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.test.StepVerifier;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DocumentDAOImplTest {

    private static final OffsetDateTime AT = OffsetDateTime.of(2024, 2, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    private DatabaseClient databaseClient;
    private DocumentDAOImpl documentDAO;

    @BeforeEach
    void setUp() {
        databaseClient = TestDatabase.create();
        documentDAO = new DocumentDAOImpl(databaseClient);
    }

    @Test
    void create_newFingerprint_returnsTrue() {
        StepVerifier.create(documentDAO.create(document("a", "alice")))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void create_existingFingerprint_returnsFalseAndKeepsFirstMetadata() {
        documentDAO.create(document("a", "alice")).block();

        StepVerifier.create(documentDAO.create(document("a", "bob")))
                .expectNext(false)
                .verifyComplete();

        StepVerifier.create(databaseClient.sql("SELECT uploaded_by, page_count, size_bytes, uploaded_at FROM documents WHERE fingerprint = :fp")
                        .bind("fp", FingerprintUtils.sha256("a"))
                        .map(row -> StoredDocument.builder()
                                .uploadedBy(row.get("uploaded_by", String.class))
                                .pageCount(row.get("page_count", Integer.class))
                                .size(row.get("size_bytes", Long.class))
                                .uploadedAt(row.get("uploaded_at", OffsetDateTime.class))
                                .build())
                        .one())
                .assertNext(stored -> {
                    assertEquals("alice", stored.getUploadedBy());
                    assertEquals(3, stored.getPageCount());
                    assertEquals(1234L, stored.getSize());
                    assertEquals(AT.toInstant(), stored.getUploadedAt().toInstant());
                })
                .verifyComplete();
    }

    static StoredDocument document(String seed, String uploader) {
        return StoredDocument.builder()
                .fingerprint(FingerprintUtils.sha256(seed))
                .size(1234L)
                .pageCount(3)
                .contentType("application/pdf")
                .originalFilename(seed + ".pdf")
                .uploadedBy(uploader)
                .uploadedAt(AT)
                .build();
    }
}
