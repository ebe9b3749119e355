package org.notevault.engine.repository.impl;

import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import org.notevault.engine.entity.CatalogEntry;
import org.notevault.engine.repository.CatalogDAO;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.notevault.engine.utils.SqlUtils.LIKE_ESCAPE;
import static org.notevault.engine.utils.SqlUtils.containsPattern;

@Service
@RequiredArgsConstructor
public class CatalogDAOImpl implements CatalogDAO {

    private static final String SELECT_ENTRY = "SELECT id, course_code, title, uploaded_by, created_at, fingerprint, active FROM catalog_entries";
    private static final String MOST_RECENT_FIRST = " ORDER BY created_at DESC, id DESC";

    private final DatabaseClient databaseClient;

    @Override
    public Mono<CatalogEntry> create(CatalogEntry entry) {
        return databaseClient.sql("INSERT INTO catalog_entries (id, course_code, title, uploaded_by, created_at, fingerprint, active) " +
                        "VALUES (:id, :course, :title, :by, :at, :fp, :active)")
                .bind("id", entry.getId())
                .bind("course", entry.getCourseCode())
                .bind("title", entry.getTitle())
                .bind("by", entry.getUploadedBy())
                .bind("at", entry.getCreatedAt())
                .bind("fp", entry.getFingerprint())
                .bind("active", entry.isActive())
                .then()
                .thenReturn(entry);
    }

    @Override
    public Mono<CatalogEntry> findActiveById(UUID id) {
        return databaseClient.sql(SELECT_ENTRY + " WHERE id = :id AND active = TRUE")
                .bind("id", id)
                .map(CatalogDAOImpl::toEntry)
                .one();
    }

    @Override
    public Flux<CatalogEntry> findActiveByCourse(String courseCode) {
        return databaseClient.sql(SELECT_ENTRY + " WHERE course_code = :course AND active = TRUE" + MOST_RECENT_FIRST)
                .bind("course", courseCode)
                .map(CatalogDAOImpl::toEntry)
                .all();
    }

    @Override
    public Flux<CatalogEntry> findAllActive() {
        return databaseClient.sql(SELECT_ENTRY + " WHERE active = TRUE" + MOST_RECENT_FIRST)
                .map(CatalogDAOImpl::toEntry)
                .all();
    }

    @Override
    public Flux<CatalogEntry> search(String query) {
        String pattern = containsPattern(query);
        return databaseClient.sql(SELECT_ENTRY + " WHERE active = TRUE AND (UPPER(course_code) LIKE :courseLike" + LIKE_ESCAPE +
                        " OR UPPER(title) LIKE :titleLike" + LIKE_ESCAPE + ")" + MOST_RECENT_FIRST)
                .bind("courseLike", pattern)
                .bind("titleLike", pattern)
                .map(CatalogDAOImpl::toEntry)
                .all();
    }

    @Override
    public Mono<Boolean> deactivate(UUID id) {
        return databaseClient.sql("UPDATE catalog_entries SET active = FALSE WHERE id = :id AND active = TRUE")
                .bind("id", id)
                .fetch()
                .rowsUpdated()
                .map(count -> count > 0);
    }

    @Override
    public Mono<Long> countActiveByUploader(String uploader) {
        return databaseClient.sql("SELECT COUNT(*) AS cnt FROM catalog_entries WHERE uploaded_by = :by AND active = TRUE")
                .bind("by", uploader)
                .map(row -> row.get("cnt", Long.class))
                .one();
    }

    @Override
    public Mono<Long> countActiveByFingerprint(String fingerprint) {
        return databaseClient.sql("SELECT COUNT(*) AS cnt FROM catalog_entries WHERE fingerprint = :fp AND active = TRUE")
                .bind("fp", fingerprint)
                .map(row -> row.get("cnt", Long.class))
                .one();
    }

    private static CatalogEntry toEntry(Readable row) {
        return CatalogEntry.builder()
                .id(row.get("id", UUID.class))
                .courseCode(row.get("course_code", String.class))
                .title(row.get("title", String.class))
                .uploadedBy(row.get("uploaded_by", String.class))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .fingerprint(row.get("fingerprint", String.class))
                .active(Boolean.TRUE.equals(row.get("active", Boolean.class)))
                .build();
    }
}
