package org.notevault.engine.repository;

import org.notevault.engine.entity.StoredDocument;
import reactor.core.publisher.Mono;

public interface DocumentDAO {

    /**
     * @return true if this call created the row, false if the fingerprint was already registered
     */
    Mono<Boolean> create(StoredDocument document);
}
