package com.example.catalog_import.dto;

import java.util.List;

/**
 * Technical attributes recovered from a release name.
 */
public record ReleaseInfo(
        String resolution,
        String quality,
        String codec,
        List<String> audio,
        List<String> hdr,
        List<String> languages,
        String releaseGroup
) {
    public ReleaseInfo {
        audio = audio == null ? List.of() : List.copyOf(audio);
        hdr = hdr == null ? List.of() : List.copyOf(hdr);
        languages = languages == null ? List.of() : List.copyOf(languages);
    }

    public static ReleaseInfo empty() {
        return new ReleaseInfo(null, null, null, List.of(), List.of(), List.of(), null);
    }
}
