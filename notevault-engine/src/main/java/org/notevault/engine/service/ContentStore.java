package org.notevault.engine.service;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Content-addressed store of original documents. Bytes are keyed by their SHA-256 fingerprint
 * and never change once stored.
 */
public interface ContentStore {

    String BLOB_EXTENSION = ".bin";
    String STAGING_EXTENSION = ".tmp";

    /**
     * Stores the bytes unless an identical blob is already present.
     *
     * @return the fingerprint of the content
     */
    Mono<String> put(byte[] content);

    /**
     * Reads a blob back and re-hashes it. Errors with {@code NotFoundException} for an unknown
     * fingerprint and {@code IntegrityException} when the stored bytes no longer match it.
     */
    Mono<byte[]> get(String fingerprint);

    Mono<Boolean> exists(String fingerprint);

    Mono<Void> delete(String fingerprint);

    /**
     * Removes staging files left behind by interrupted writes.
     *
     * @return number of files removed
     */
    Mono<Long> cleanupStaging(Duration olderThan);
}
