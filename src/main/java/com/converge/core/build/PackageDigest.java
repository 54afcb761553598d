package com.converge.core.build;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;

/**
 * SHA-256 helpers for deployment packages and API documents.
 */
public final class PackageDigest {

    private PackageDigest() {}

    /** Base64 SHA-256 of a file, the encoding the function service reports as {@code CodeSha256}. */
    public static String sha256Base64(Path file) {
        return Base64.getEncoder().encodeToString(digest(file));
    }

    public static String sha256Hex(Path file) {
        return HexFormat.of().formatHex(digest(file));
    }

    public static String sha256Hex(byte[] content) {
        return HexFormat.of().formatHex(newDigest().digest(content));
    }

    private static byte[] digest(Path file) {
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + file, e);
        }
        return digest.digest();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
