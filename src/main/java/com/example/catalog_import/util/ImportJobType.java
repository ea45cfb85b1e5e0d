package com.example.catalog_import.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImportJobType {
    M3U,
    XTREAM,
    NZB_URLS,
    RSS,
    IPTV_SYNC;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
