package com.williamcallahan.pdfrag.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * SHA-256 digests used for document and chunk identity.
 */
@Component
public class ContentHasher {
    private static final int BUFFER_SIZE = 8192;
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Hashes a byte stream in fixed-size blocks without buffering it whole.
     *
     * @param input stream to consume; not closed
     * @return lowercase hex digest
     * @throws IOException when reading fails
     */
    public String hashBytes(InputStream input) throws IOException {
        Objects.requireNonNull(input, "input");
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = input.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Hashes a file's raw bytes.
     */
    public String hashFile(Path file) throws IOException {
        try (InputStream input = Files.newInputStream(file)) {
            return hashBytes(input);
        }
    }

    /**
     * Hashes text after lower-casing, trimming and collapsing whitespace runs to single spaces,
     * so formatting-only differences produce the same digest.
     *
     * @param text text to hash
     * @return lowercase hex digest
     */
    public String hashNormalizedText(String text) {
        Objects.requireNonNull(text, "text");
        return sha256(normalize(text));
    }

    /**
     * Generates SHA-256 hash for any text content.
     *
     * @param text The text to hash
     * @return Hexadecimal string representation of the hash
     */
    public String sha256(String text) {
        MessageDigest digest = newDigest();
        return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    static String normalize(String text) {
        return WHITESPACE_RUN.matcher(text.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
