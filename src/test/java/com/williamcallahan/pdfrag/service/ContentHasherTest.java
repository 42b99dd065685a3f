package com.williamcallahan.pdfrag.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies document and text digests used for deduplication.
 */
class ContentHasherTest {

    private final ContentHasher contentHasher = new ContentHasher();

    @Test
    void hashNormalizedText_ignoresCaseAndWhitespaceLayout() {
        String compact = contentHasher.hashNormalizedText("Motor de inducción trifásico");
        String spread = contentHasher.hashNormalizedText("  MOTOR de\n\tinducción   TRIFÁSICO \n");

        assertEquals(compact, spread);
        assertEquals(64, compact.length());
    }

    @Test
    void hashNormalizedText_distinguishesDifferentWords() {
        assertNotEquals(
                contentHasher.hashNormalizedText("voltage rating"),
                contentHasher.hashNormalizedText("current rating"));
    }

    @Test
    void sha256_matchesKnownDigest() {
        assertEquals(
                "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                contentHasher.sha256("abc"));
    }

    @Test
    void hashFile_matchesStreamDigestOfSameBytes(@TempDir Path tempDir) throws IOException {
        byte[] content = "%PDF-1.4 sample bytes".repeat(1000).getBytes(StandardCharsets.UTF_8);
        Path file = tempDir.resolve("manual.pdf");
        Files.write(file, content);

        assertEquals(
                contentHasher.hashBytes(new ByteArrayInputStream(content)),
                contentHasher.hashFile(file));
    }
}
