package org.notevault.engine.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.notevault.engine.config.StorageProperties;
import org.notevault.engine.exception.IntegrityException;
import org.notevault.engine.exception.NotFoundException;
import org.notevault.engine.utils.FingerprintUtils;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemContentStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private FileSystemContentStore store;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setBasePath(tempDir.toString());
        store = new FileSystemContentStore(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void put_storesBlobUnderShardedPath() {
        byte[] content = "lecture notes".getBytes(StandardCharsets.UTF_8);
        String fingerprint = FingerprintUtils.sha256(content);

        StepVerifier.create(store.put(content))
                .expectNext(fingerprint)
                .verifyComplete();

        Path expected = tempDir.resolve(fingerprint.substring(0, 2)).resolve(fingerprint.substring(2, 4))
                .resolve(fingerprint + ".bin");
        assertTrue(Files.exists(expected));
        assertEquals(expected, store.resolve(fingerprint));
    }

    @Test
    void put_sameBytesTwice_keepsSingleBlob() throws IOException {
        byte[] content = "same bytes".getBytes(StandardCharsets.UTF_8);

        String first = store.put(content).block();
        String second = store.put(content.clone()).block();

        assertEquals(first, second);
        assertEquals(1, countFiles());
    }

    @Test
    void put_concurrentIdenticalBytes_producesOneBlob() throws IOException {
        byte[] content = "raced upload".getBytes(StandardCharsets.UTF_8);

        List<String> fingerprints = Flux.range(0, 8)
                .parallel(8)
                .runOn(Schedulers.parallel())
                .flatMap(i -> store.put(content))
                .sequential()
                .collectList()
                .block();

        assertNotNull(fingerprints);
        assertEquals(8, fingerprints.size());
        assertEquals(1, fingerprints.stream().distinct().count());
        assertEquals(1, countFiles(), "no staging file or second copy may remain");
    }

    @Test
    void get_returnsStoredBytes() {
        byte[] content = "round trip".getBytes(StandardCharsets.UTF_8);
        String fingerprint = store.put(content).block();

        StepVerifier.create(store.get(fingerprint))
                .expectNextMatches(bytes -> Arrays.equals(content, bytes))
                .verifyComplete();
    }

    @Test
    void get_unknownFingerprint_failsWithNotFound() {
        StepVerifier.create(store.get(FingerprintUtils.sha256("never stored")))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void get_malformedFingerprint_failsWithNotFound() {
        StepVerifier.create(store.get("../../etc/passwd"))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void get_tamperedBlob_failsWithIntegrityException() throws IOException {
        String fingerprint = store.put("original".getBytes(StandardCharsets.UTF_8)).block();
        Files.writeString(store.resolve(fingerprint), "tampered");

        StepVerifier.create(store.get(fingerprint))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(IntegrityException.class, e);
                    assertEquals(fingerprint, ((IntegrityException) e).getFingerprint());
                })
                .verify();
    }

    @Test
    void exists_reflectsStoredState() {
        String fingerprint = store.put("exists".getBytes(StandardCharsets.UTF_8)).block();

        StepVerifier.create(store.exists(fingerprint)).expectNext(true).verifyComplete();
        StepVerifier.create(store.exists(FingerprintUtils.sha256("other"))).expectNext(false).verifyComplete();
        StepVerifier.create(store.exists("not-a-fingerprint")).expectNext(false).verifyComplete();
    }

    @Test
    void delete_removesBlob() {
        String fingerprint = store.put("to delete".getBytes(StandardCharsets.UTF_8)).block();

        StepVerifier.create(store.delete(fingerprint)).verifyComplete();
        assertFalse(Files.exists(store.resolve(fingerprint)));
    }

    @Test
    void cleanupStaging_removesOnlyOldStagingFiles() throws IOException {
        Path shard = Files.createDirectories(tempDir.resolve("ab").resolve("cd"));
        Path old = Files.writeString(shard.resolve("abcd-1.tmp"), "partial");
        Files.setLastModifiedTime(old, FileTime.from(NOW.minus(Duration.ofHours(2))));
        Path fresh = Files.writeString(shard.resolve("abcd-2.tmp"), "in progress");
        Files.setLastModifiedTime(fresh, FileTime.from(NOW.minus(Duration.ofMinutes(5))));
        String fingerprint = store.put("kept".getBytes(StandardCharsets.UTF_8)).block();
        Files.setLastModifiedTime(store.resolve(fingerprint), FileTime.from(NOW.minus(Duration.ofDays(3))));

        StepVerifier.create(store.cleanupStaging(Duration.ofHours(1)))
                .expectNext(1L)
                .verifyComplete();

        assertFalse(Files.exists(old));
        assertTrue(Files.exists(fresh));
        assertTrue(Files.exists(store.resolve(fingerprint)));
    }

    private long countFiles() throws IOException {
        try (Stream<Path> files = Files.walk(tempDir)) {
            return files.filter(Files::isRegularFile).count();
        }
    }
}
