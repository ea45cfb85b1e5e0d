package com.example.catalog_import.service.source.torrent;

import com.example.catalog_import.service.source.AnalysisException;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Parsed {@code magnet:?xt=urn:btih:...} link.
 */
public record MagnetLink(String infoHash, String displayName, List<String> trackers, Long exactLength) {

    private static final String BASE32 = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";

    public static MagnetLink parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw AnalysisException.malformed("Magnet link is required");
        }
        String link = raw.trim();
        if (!link.regionMatches(true, 0, "magnet:?", 0, 8)) {
            throw AnalysisException.malformed("Not a magnet link");
        }
        String infoHash = null;
        String name = null;
        Long length = null;
        List<String> trackers = new ArrayList<>();
        boolean v2Only = false;
        for (String pair : link.substring(8).split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = pair.substring(0, eq).toLowerCase(Locale.ROOT);
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            switch (key) {
                case "xt" -> {
                    String lower = value.toLowerCase(Locale.ROOT);
                    if (lower.startsWith("urn:btih:")) {
                        infoHash = normalizeHash(value.substring(9));
                    } else if (lower.startsWith("urn:btmh:")) {
                        v2Only = true;
                    }
                }
                case "dn" -> name = value;
                case "tr" -> trackers.add(value);
                case "xl" -> {
                    if (value.matches("\\d{1,18}")) {
                        length = Long.parseLong(value);
                    }
                }
                default -> {
                }
            }
        }
        if (infoHash == null) {
            if (v2Only) {
                throw AnalysisException.unsupported("BitTorrent v2-only magnet links are not supported");
            }
            throw AnalysisException.malformed("Magnet link has no btih info hash");
        }
        return new MagnetLink(infoHash, name, List.copyOf(trackers), length);
    }

    /** Rebuilds a canonical link carrying the hash, name and trackers. */
    public String toUri() {
        StringBuilder sb = new StringBuilder("magnet:?xt=urn:btih:").append(infoHash);
        if (displayName != null) {
            sb.append("&dn=").append(URLEncoder.encode(displayName, StandardCharsets.UTF_8));
        }
        for (String tracker : trackers) {
            sb.append("&tr=").append(URLEncoder.encode(tracker, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    static String normalizeHash(String hash) {
        String trimmed = hash.trim();
        if (trimmed.matches("[0-9a-fA-F]{40}")) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
        if (trimmed.matches("[A-Za-z2-7]{32}")) {
            return HexFormat.of().formatHex(base32Decode(trimmed.toUpperCase(Locale.ROOT)));
        }
        throw AnalysisException.malformed("Invalid info hash '" + hash + "'");
    }

    private static byte[] base32Decode(String value) {
        byte[] out = new byte[value.length() * 5 / 8];
        int buffer = 0;
        int bits = 0;
        int index = 0;
        for (char c : value.toCharArray()) {
            buffer = (buffer << 5) | BASE32.indexOf(c);
            bits += 5;
            if (bits >= 8) {
                out[index++] = (byte) (buffer >> (bits - 8));
                bits -= 8;
            }
        }
        return out;
    }
}
