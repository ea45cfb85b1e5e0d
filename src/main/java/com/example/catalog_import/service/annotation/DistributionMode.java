package com.example.catalog_import.service.annotation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DistributionMode {
    /** Split the included files evenly over the listed seasons. */
    AUTO,
    /** Fill each listed season with a fixed number of episodes. */
    MANUAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DistributionMode fromId(String raw) {
        return raw == null || raw.isBlank() ? AUTO : valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
