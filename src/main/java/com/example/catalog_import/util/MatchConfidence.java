package com.example.catalog_import.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Strength of a candidate match; lower rank sorts first.
 */
public enum MatchConfidence {
    EXACT(0),
    YEAR_NEAR(1),
    FUZZY(2);

    private final int rank;

    MatchConfidence(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
