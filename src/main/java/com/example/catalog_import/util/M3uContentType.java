package com.example.catalog_import.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum M3uContentType {
    TV,
    MOVIE,
    SERIES,
    UNKNOWN;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static M3uContentType fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return UNKNOWN;
        }
    }

    public MetaType toMetaType() {
        return switch (this) {
            case TV -> MetaType.TV;
            case MOVIE -> MetaType.MOVIE;
            case SERIES -> MetaType.SERIES;
            case UNKNOWN -> null;
        };
    }
}
