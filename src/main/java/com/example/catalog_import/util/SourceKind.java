package com.example.catalog_import.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceKind {
    TORRENT("torrent"),
    MAGNET("magnet"),
    M3U("m3u"),
    XTREAM("xtream"),
    NZB("nzb"),
    YOUTUBE("youtube"),
    HTTP("http"),
    ACESTREAM("acestream");

    private final String id;

    SourceKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static SourceKind fromId(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("source kind is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + raw);
    }
}
