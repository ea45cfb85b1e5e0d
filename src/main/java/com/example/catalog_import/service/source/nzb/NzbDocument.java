package com.example.catalog_import.service.source.nzb;

import java.util.List;

/**
 * Parsed NZB. {@code guid} is the first 40 hex characters of the SHA-256 of the raw document.
 */
public record NzbDocument(
        String guid,
        String title,
        String password,
        String category,
        List<NzbFile> files,
        List<String> groups
) {
    public record NzbFile(
            String subject,
            String filename,
            String poster,
            Long postedAt,
            List<String> groups,
            long bytes,
            int segments
    ) {}

    public long totalBytes() {
        return files.stream().mapToLong(NzbFile::bytes).sum();
    }
}
