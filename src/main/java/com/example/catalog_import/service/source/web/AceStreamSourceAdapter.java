package com.example.catalog_import.service.source.web;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapter;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.ReleaseNameParser;
import com.example.catalog_import.util.SourceKind;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AceStream content id. There is no public endpoint to probe, so only the id shape is checked.
 */
@Component
public class AceStreamSourceAdapter implements SourceAdapter<ImportSource.AceStream> {
    private static final Pattern CONTENT_ID = Pattern.compile("^[a-fA-F0-9]{40}$");
    private static final Pattern ACESTREAM_URL = Pattern.compile("acestream://([a-fA-F0-9]{40})");

    @Override
    public Class<ImportSource.AceStream> sourceType() {
        return ImportSource.AceStream.class;
    }

    @Override
    public AnalyzedItem analyze(ImportSource.AceStream source, MetaType metaType) {
        String contentId = extractContentId(source.contentId());
        String displayName = source.name() != null && !source.name().isBlank() ? source.name().trim() : "AceStream " + contentId;
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse(source.name());

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("content_id", contentId);
        attributes.put("url", "acestream://" + contentId);
        FileEntry file = new FileEntry(0, displayName, 0L, parsed.season(), parsed.episode(), parsed.episodeEnd(), true, null);
        return new AnalyzedItem(SourceKind.ACESTREAM, "acestream:" + contentId, displayName, parsed.title(),
                parsed.year(), parsed.release(), null, List.of(file), List.of(), attributes);
    }

    public static String extractContentId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw AnalysisException.malformed("AceStream content id is required");
        }
        String value = raw.trim();
        if (CONTENT_ID.matcher(value).matches()) {
            return value.toLowerCase(Locale.ROOT);
        }
        Matcher m = ACESTREAM_URL.matcher(value);
        if (m.find()) {
            return m.group(1).toLowerCase(Locale.ROOT);
        }
        throw AnalysisException.malformed("AceStream id must be 40 hexadecimal characters");
    }
}
