package com.e2eq.persistence.util;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CommonUtilsTest {

    @Test
    void testKnownDigest() {
        // SHA-256 of "abc"
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            CommonUtils.calculateSHA256("abc"));
    }

    @Test
    void testStreamAndByteDigestAgree() throws IOException {
        byte[] content = new byte[10_000];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i % 251);
        }

        String fromBytes = CommonUtils.calculateSHA256(content);
        String fromStream = CommonUtils.calculateSHA256(new ByteArrayInputStream(content));

        assertEquals(fromBytes, fromStream, "Chunked digest should match single pass digest");
        assertEquals(64, fromStream.length());
        assertTrue(fromStream.matches("[0-9a-f]+"));
    }

    @Test
    void testNullInput() {
        assertNull(CommonUtils.calculateSHA256((String) null));
        assertNull(CommonUtils.calculateSHA256((byte[]) null));
    }

    @Test
    void testDifferentContentDifferentDigest() {
        assertNotEquals(CommonUtils.calculateSHA256("v1".getBytes(StandardCharsets.UTF_8)),
            CommonUtils.calculateSHA256("v2".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testCloseStreamsContinuesAfterFailure() {
        AtomicInteger closed = new AtomicInteger();
        Closeable failing = () -> {
            closed.incrementAndGet();
            throw new IOException("boom");
        };
        Closeable ok = closed::incrementAndGet;

        assertDoesNotThrow(() -> CommonUtils.closeStreams(failing, null, ok));
        assertEquals(2, closed.get());
    }
}
