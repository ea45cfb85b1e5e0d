package com.example.catalog_import.service.source.m3u;

import com.example.catalog_import.service.source.AnalysisException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented M3U/M3U8 playlist parser. Entries are numbered in playlist order starting at 0.
 */
public final class M3uParser {
    private static final Pattern ATTRIBUTE = Pattern.compile("([\\w-]+)=\"([^\"]*)\"");
    private static final Pattern GENRE_SPLIT = Pattern.compile("[,;|]");

    private M3uParser() {
    }

    public static List<M3uEntry> parse(String content) {
        if (content == null || content.isBlank()) {
            throw AnalysisException.malformed("Playlist is empty");
        }
        String[] lines = content.replace("\r\n", "\n").replace('\r', '\n').split("\n");
        String first = lines[0].replace("﻿", "").trim();
        boolean extended = first.toUpperCase(Locale.ROOT).startsWith("#EXTM3U");

        List<M3uEntry> entries = new ArrayList<>();
        String pendingInfo = null;
        String pendingGroup = null;
        for (String rawLine : lines) {
            String line = rawLine.replace("﻿", "").trim();
            if (line.isEmpty()) {
                continue;
            }
            String upper = line.toUpperCase(Locale.ROOT);
            if (upper.startsWith("#EXTINF")) {
                pendingInfo = line;
                pendingGroup = null;
            } else if (upper.startsWith("#EXTGRP:")) {
                pendingGroup = line.substring(8).trim();
            } else if (!line.startsWith("#")) {
                if (pendingInfo != null || !extended) {
                    entries.add(toEntry(entries.size(), pendingInfo, pendingGroup, line));
                }
                pendingInfo = null;
                pendingGroup = null;
            }
        }
        if (entries.isEmpty()) {
            throw extended
                    ? AnalysisException.malformed("Playlist contains no entries")
                    : AnalysisException.unsupported("Not an M3U playlist");
        }
        return entries;
    }

    private static M3uEntry toEntry(int index, String info, String extGroup, String url) {
        Map<String, String> attrs = new HashMap<>();
        String name = null;
        if (info != null) {
            int comma = displayNameComma(info);
            String head = comma >= 0 ? info.substring(0, comma) : info;
            Matcher m = ATTRIBUTE.matcher(head);
            while (m.find()) {
                attrs.put(m.group(1).toLowerCase(Locale.ROOT), m.group(2).trim());
            }
            name = comma >= 0 ? info.substring(comma + 1).trim() : null;
        }
        if (name == null || name.isEmpty()) {
            name = attrs.getOrDefault("tvg-name", fallbackName(url));
        }
        String group = blankToNull(attrs.getOrDefault("group-title", extGroup));
        List<String> genres = group == null ? List.of() : Arrays.stream(GENRE_SPLIT.split(group))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();

        M3uContentClassifier.Classification c = M3uContentClassifier.classify(name, group, url);
        return new M3uEntry(
                index,
                name,
                url,
                blankToNull(attrs.get("tvg-logo")),
                group,
                genres,
                blankToNull(attrs.get("tvg-country")),
                blankToNull(attrs.get("tvg-language")),
                blankToNull(attrs.get("tvg-id")),
                blankToNull(attrs.get("tvg-name")),
                c.type(),
                c.title(),
                c.year(),
                c.season(),
                c.episode());
    }

    /** First comma outside double quotes separates attributes from the display name. */
    private static int displayNameComma(String info) {
        boolean quoted = false;
        for (int i = 0; i < info.length(); i++) {
            char c = info.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ',' && !quoted) {
                return i;
            }
        }
        return -1;
    }

    private static String fallbackName(String url) {
        String trimmed = url.replaceAll("[?#].*$", "");
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 && slash < trimmed.length() - 1 ? trimmed.substring(slash + 1) : url;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
