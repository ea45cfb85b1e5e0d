package com.example.catalog_import.service.source;

import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.util.ReleaseNameParser;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers shared by the adapters for building file entries and content identities.
 */
public final class SourceFiles {
    private static final Pattern SAMPLE = Pattern.compile("(?i)(?<![a-z])sample(?![a-z])");

    private SourceFiles() {
    }

    /**
     * Builds a file entry with season/episode inferred from the filename. Non-video files and samples
     * start out excluded.
     */
    public static FileEntry entry(int index, String path, long size) {
        String name = baseName(path);
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse(name);
        boolean included = ReleaseNameParser.isVideoFile(name) && !isSample(path);
        return new FileEntry(index, path, size, parsed.season(), parsed.episode(), parsed.episodeEnd(), included, null);
    }

    public static boolean isSample(String path) {
        return path != null && SAMPLE.matcher(path).find();
    }

    public static String baseName(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    public static String sha256Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Identity for URL-addressed streams: {@code url:} plus 40 hex chars of the URL's SHA-256. */
    public static String urlIdentity(String url) {
        String normalized = url.trim();
        return "url:" + sha256Hex(normalized.getBytes(StandardCharsets.UTF_8)).substring(0, 40);
    }

    public static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
