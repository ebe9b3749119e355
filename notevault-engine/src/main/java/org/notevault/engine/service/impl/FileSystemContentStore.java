package org.notevault.engine.service.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.notevault.engine.config.StorageProperties;
import org.notevault.engine.exception.AbstractNoteVaultException;
import org.notevault.engine.exception.IntegrityException;
import org.notevault.engine.exception.NotFoundException;
import org.notevault.engine.exception.StorageException;
import org.notevault.engine.service.ContentStore;
import org.notevault.engine.utils.FingerprintUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stores blobs under {@code <base-path>/ab/cd/<fingerprint>.bin}.
 * <p>
 * A new blob is first written to a staging file next to its final location and then published
 * with an atomic hard link. When two uploads of identical bytes race, exactly one link succeeds;
 * the loser discards its staging copy and re-hashes the winner's blob instead of overwriting it.
 */
@Slf4j
@Service
public class FileSystemContentStore implements ContentStore {

    @Getter
    private final Path rootLocation;

    private final Clock clock;

    public FileSystemContentStore(StorageProperties storageProperties, Clock clock) {
        this.rootLocation = Paths.get(storageProperties.getBasePath());
        this.clock = clock;
        try {
            Files.createDirectories(rootLocation);
            log.info("Content store initialized at: {}", rootLocation.toAbsolutePath());
        } catch (IOException e) {
            log.error("Could not initialize content store location: {}", rootLocation, e);
            throw new StorageException("Could not initialize content store", e);
        }
    }

    @Override
    public Mono<String> put(byte[] content) {
        return Mono.fromCallable(() -> {
                    String fingerprint = FingerprintUtils.sha256(content);
                    Path target = resolve(fingerprint);
                    if (Files.exists(target)) {
                        confirmExisting(fingerprint, target);
                        log.debug("Blob {} already stored", fingerprint);
                        return fingerprint;
                    }
                    Files.createDirectories(target.getParent());
                    Path staging = Files.createTempFile(target.getParent(), fingerprint + "-", STAGING_EXTENSION);
                    try {
                        writeDurably(staging, content);
                        publish(staging, target, fingerprint);
                    } finally {
                        Files.deleteIfExists(staging);
                    }
                    return fingerprint;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(IOException.class, e -> {
                    log.error("Could not store blob: {}", e.getMessage());
                    return new StorageException("Could not store document content", e);
                });
    }

    @Override
    public Mono<byte[]> get(String fingerprint) {
        return Mono.fromCallable(() -> {
                    if (!FingerprintUtils.isFingerprint(fingerprint) || !Files.exists(resolve(fingerprint))) {
                        throw NotFoundException.document(fingerprint);
                    }
                    byte[] content = Files.readAllBytes(resolve(fingerprint));
                    String actual = FingerprintUtils.sha256(content);
                    if (!actual.equals(fingerprint)) {
                        log.error("INTEGRITY VIOLATION: blob {} now hashes to {}", fingerprint, actual);
                        throw new IntegrityException(fingerprint, actual);
                    }
                    return content;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof AbstractNoteVaultException), e -> {
                    log.error("Error loading blob {}: {}", fingerprint, e.getMessage());
                    return new StorageException("Error loading blob " + fingerprint, e);
                });
    }

    @Override
    public Mono<Boolean> exists(String fingerprint) {
        return Mono.fromCallable(() -> FingerprintUtils.isFingerprint(fingerprint) && Files.exists(resolve(fingerprint)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> delete(String fingerprint) {
        return Mono.fromRunnable(() -> {
            if (!FingerprintUtils.isFingerprint(fingerprint)) {
                throw NotFoundException.document(fingerprint);
            }
            try {
                if (Files.deleteIfExists(resolve(fingerprint))) {
                    log.info("Blob deleted: {}", fingerprint);
                } else {
                    log.warn("Blob {} not found for deletion, presumed already deleted.", fingerprint);
                }
            } catch (IOException e) {
                log.error("Could not delete blob: {}", fingerprint, e);
                throw new StorageException("Could not delete blob: " + fingerprint, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<Long> cleanupStaging(Duration olderThan) {
        return Mono.fromCallable(() -> {
            Instant cutoff = clock.instant().minus(olderThan);
            AtomicLong removed = new AtomicLong();
            Files.walkFileTree(rootLocation, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    if (file.getFileName().toString().endsWith(STAGING_EXTENSION)
                            && attrs.lastModifiedTime().toInstant().isBefore(cutoff)
                            && Files.deleteIfExists(file)) {
                        log.info("Removed abandoned staging file: {}", rootLocation.relativize(file));
                        removed.incrementAndGet();
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
            return removed.get();
        }).subscribeOn(Schedulers.boundedElastic())
          .onErrorMap(IOException.class, e -> new StorageException("Could not clean up staging files", e));
    }

    Path resolve(String fingerprint) {
        return rootLocation
                .resolve(fingerprint.substring(0, 2))
                .resolve(fingerprint.substring(2, 4))
                .resolve(fingerprint + BLOB_EXTENSION)
                .normalize();
    }

    private void writeDurably(Path staging, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(staging, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content).asReadOnlyBuffer();
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void publish(Path staging, Path target, String fingerprint) throws IOException {
        try {
            Files.createLink(target, staging);
            log.info("Blob stored: {} ({} bytes)", fingerprint, Files.size(target));
        } catch (FileAlreadyExistsException e) {
            log.debug("Blob {} was stored concurrently, keeping the first copy", fingerprint);
            confirmExisting(fingerprint, target);
        } catch (UnsupportedOperationException e) {
            try {
                Files.move(staging, target);
                log.info("Blob stored: {}", fingerprint);
            } catch (FileAlreadyExistsException alreadyStored) {
                confirmExisting(fingerprint, target);
            }
        }
    }

    private void confirmExisting(String fingerprint, Path target) throws IOException {
        String actual = FingerprintUtils.sha256(target);
        if (!actual.equals(fingerprint)) {
            log.error("INTEGRITY VIOLATION: existing blob {} hashes to {}", fingerprint, actual);
            throw new IntegrityException(fingerprint, actual);
        }
    }
}
