package org.notevault.engine.repository.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.notevault.engine.entity.StoredDocument;
import org.notevault.engine.repository.DocumentDAO;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentDAOImpl implements DocumentDAO {

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Boolean> create(StoredDocument document) {
        return databaseClient.sql("INSERT INTO documents (fingerprint, size_bytes, page_count, content_type, original_filename, uploaded_by, uploaded_at) " +
                        "VALUES (:fp, :size, :pages, :ct, :name, :by, :at)")
                .bind("fp", document.getFingerprint())
                .bind("size", document.getSize())
                .bind("pages", document.getPageCount())
                .bind("ct", document.getContentType())
                .bind("name", document.getOriginalFilename())
                .bind("by", document.getUploadedBy())
                .bind("at", document.getUploadedAt())
                .fetch()
                .rowsUpdated()
                .map(count -> count > 0)
                .onErrorResume(DuplicateKeyException.class, e -> {
                    log.debug("Document {} already registered, keeping first upload metadata", document.getFingerprint());
                    return Mono.just(false);
                });
    }
}
