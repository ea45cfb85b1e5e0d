package com.example.catalog_import.service.source.web;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapter;
import com.example.catalog_import.service.source.SourceFiles;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.ReleaseNameParser;
import com.example.catalog_import.util.SourceKind;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Direct HTTP(S) stream: validates the URL, detects the container format and probes liveness.
 */
@Component
public class HttpSourceAdapter implements SourceAdapter<ImportSource.Http> {
    private final HttpProbe probe;

    public HttpSourceAdapter(HttpProbe probe) {
        this.probe = probe;
    }

    @Override
    public Class<ImportSource.Http> sourceType() {
        return ImportSource.Http.class;
    }

    @Override
    public AnalyzedItem analyze(ImportSource.Http source, MetaType metaType) {
        URI uri = SourceFetcher.requireHttpUrl(source.url());
        HttpProbe.Result result = probe.probe(uri);

        String fileName = fileName(uri);
        String displayName = source.name() != null && !source.name().isBlank() ? source.name().trim() : fileName;
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse(displayName);
        long size = result.contentLength() == null ? 0L : result.contentLength();

        FileEntry file = new FileEntry(0, fileName, size, parsed.season(), parsed.episode(), parsed.episodeEnd(), true, null);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("url", uri.toString());
        attributes.put("format", detectFormat(uri, result.contentType()));
        return new AnalyzedItem(SourceKind.HTTP, SourceFiles.urlIdentity(uri.toString()), displayName, parsed.title(),
                parsed.year(), parsed.release(), result.contentLength(), List.of(file), List.of(), attributes);
    }

    static String detectFormat(URI uri, String contentType) {
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (path.endsWith(".m3u8") || type.contains("mpegurl")) {
            return "hls";
        }
        if (path.endsWith(".mpd") || type.contains("dash+xml")) {
            return "dash";
        }
        for (String ext : List.of("mp4", "mkv", "webm", "avi", "flv", "ts", "mov")) {
            if (path.endsWith("." + ext)) {
                return ext;
            }
        }
        if (type.startsWith("video/")) {
            return type.substring(6);
        }
        return "unknown";
    }

    private static String fileName(URI uri) {
        String path = uri.getPath();
        String name = SourceFiles.baseName(path == null ? "" : URLDecoder.decode(path, StandardCharsets.UTF_8));
        return name.isBlank() ? uri.getHost() : name;
    }
}
