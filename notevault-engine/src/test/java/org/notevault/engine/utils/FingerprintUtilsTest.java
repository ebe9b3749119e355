package org.notevault.engine.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintUtilsTest {

    private static final String HELLO_SHA256 = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";

    @Test
    void sha256_ofBytes_matchesKnownDigest() {
        assertEquals(HELLO_SHA256, FingerprintUtils.sha256("hello".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void sha256_ofFile_matchesBytesDigest(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("hello.txt");
        Files.writeString(file, "hello");
        assertEquals(HELLO_SHA256, FingerprintUtils.sha256(file));
    }

    @Test
    void isFingerprint_acceptsLowercaseHexOnly() {
        assertTrue(FingerprintUtils.isFingerprint(HELLO_SHA256));
        assertFalse(FingerprintUtils.isFingerprint(HELLO_SHA256.toUpperCase()));
        assertFalse(FingerprintUtils.isFingerprint("../../etc/passwd"));
        assertFalse(FingerprintUtils.isFingerprint(HELLO_SHA256.substring(1)));
        assertFalse(FingerprintUtils.isFingerprint(null));
    }
}
