package com.example.catalog_import.service.source.torrent;

import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.service.source.SourceFiles;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads name, file list, trackers and info hash from a {@code .torrent} file (single and multi-file layouts).
 */
public final class TorrentMetainfoParser {

    private TorrentMetainfoParser() {
    }

    public static TorrentMetainfo parse(byte[] data) {
        BencodeDecoder.TopLevel top = BencodeDecoder.decodeTopLevel(data);
        Map<String, Object> info = dict(top.values().get("info"), "info");
        byte[] rawInfo = top.rawValues().get("info");

        String name = string(info.containsKey("name.utf-8") ? info.get("name.utf-8") : info.get("name"));
        if (name == null || name.isBlank()) {
            throw new BencodeException("info.name is missing");
        }

        List<FileEntry> files = new ArrayList<>();
        long total = 0;
        Object fileList = info.get("files");
        if (fileList instanceof List<?> entries) {
            int index = 0;
            for (Object raw : entries) {
                Map<String, Object> file = dict(raw, "files[" + index + "]");
                long length = number(file.get("length"), "files[" + index + "].length");
                Object pathValue = file.containsKey("path.utf-8") ? file.get("path.utf-8") : file.get("path");
                if (!(pathValue instanceof List<?> parts) || parts.isEmpty()) {
                    throw new BencodeException("files[" + index + "].path is missing");
                }
                List<String> segments = new ArrayList<>();
                for (Object part : parts) {
                    segments.add(string(part));
                }
                // padding files of hybrid torrents are not content
                if (segments.get(0).equals(".pad")) {
                    index++;
                    continue;
                }
                files.add(SourceFiles.entry(files.size(), String.join("/", segments), length));
                total += length;
                index++;
            }
        } else {
            long length = number(info.get("length"), "info.length");
            files.add(SourceFiles.entry(0, name, length));
            total = length;
        }

        Object isPrivate = info.get("private");
        return new TorrentMetainfo(
                sha1Hex(rawInfo),
                name,
                files,
                total,
                trackers(top.values()),
                isPrivate instanceof Long flag && flag == 1L,
                string(top.values().get("comment")),
                string(top.values().get("created by")));
    }

    private static List<String> trackers(Map<String, Object> root) {
        Set<String> trackers = new LinkedHashSet<>();
        String announce = string(root.get("announce"));
        if (announce != null && !announce.isBlank()) {
            trackers.add(announce);
        }
        if (root.get("announce-list") instanceof List<?> tiers) {
            for (Object tier : tiers) {
                if (tier instanceof List<?> urls) {
                    for (Object url : urls) {
                        String value = string(url);
                        if (value != null && !value.isBlank()) {
                            trackers.add(value);
                        }
                    }
                }
            }
        }
        return new ArrayList<>(trackers);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> dict(Object value, String field) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new BencodeException(field + " is not a dictionary");
    }

    private static long number(Object value, String field) {
        if (value instanceof Long number && number >= 0) {
            return number;
        }
        throw new BencodeException(field + " is not a non-negative integer");
    }

    private static String string(Object value) {
        return value instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8) : null;
    }

    static String sha1Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
