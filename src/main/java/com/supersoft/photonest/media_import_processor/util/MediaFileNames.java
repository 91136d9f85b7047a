package com.supersoft.photonest.media_import_processor.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public final class MediaFileNames {

    private MediaFileNames() {
    }

    /**
     * Lower-case extension including the dot, or an empty string.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        int dot = filename.lastIndexOf('.');
        if (dot <= slash + 1 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    public static String extensionFor(String filename, String mimeType) {
        String ext = extensionOf(filename);
        if (!ext.isEmpty() || mimeType == null) {
            return ext;
        }
        switch (mimeType.toLowerCase(Locale.ROOT)) {
            case "image/jpeg":
                return ".jpg";
            case "image/png":
                return ".png";
            case "image/heic":
                return ".heic";
            case "image/gif":
                return ".gif";
            case "video/mp4":
                return ".mp4";
            case "video/quicktime":
                return ".mov";
            default:
                return "";
        }
    }

    public static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            byte[] buffer = new byte[64 * 1024];
            while (in.read(buffer) != -1) {
                // digest is updated by the stream
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
