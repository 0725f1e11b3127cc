package org.stianloader.picodep.internal;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.jetbrains.annotations.NotNull;

/**
 * Hex digests of strings, byte arrays and files. Files are digested in a streaming
 * fashion so tarballs of any size can be verified.
 */
public final class Digests {

    private static final int BUFFER_SIZE = 8192;

    private Digests() {
    }

    @NotNull
    private static MessageDigest newDigest(@NotNull String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            // MD5 and SHA-1 must be supported by every JVM
            throw new AssertionError(algorithm + " not available", e);
        }
    }

    @NotNull
    public static String sha1Hex(@NotNull String text) {
        MessageDigest digest = Digests.newDigest("SHA-1");
        return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    @NotNull
    public static String md5Hex(byte @NotNull[] data) {
        MessageDigest digest = Digests.newDigest("MD5");
        return HexFormat.of().formatHex(digest.digest(data));
    }

    @NotNull
    public static String md5Hex(@NotNull Path file) throws IOException {
        MessageDigest digest = Digests.newDigest("MD5");
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
