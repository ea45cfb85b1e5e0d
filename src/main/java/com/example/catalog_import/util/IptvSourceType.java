package com.example.catalog_import.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IptvSourceType {
    M3U,
    XTREAM;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
