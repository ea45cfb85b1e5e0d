package com.example.catalog_import.service.source.nzb;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.service.source.SourceAdapter;
import com.example.catalog_import.service.source.SourceFiles;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.ReleaseNameParser;
import com.example.catalog_import.util.SourceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class NzbSourceAdapter implements SourceAdapter<ImportSource.NzbFile> {
    // first volume of a split archive, e.g. name.rar, name.part01.rar, name.zip, name.7z
    private static final Pattern MAIN_ARCHIVE = Pattern.compile("(?i)(?:(?<!\\.part\\d{1,3})\\.rar|\\.part0*1\\.rar|\\.zip|\\.7z)$");

    @Override
    public Class<ImportSource.NzbFile> sourceType() {
        return ImportSource.NzbFile.class;
    }

    @Override
    public AnalyzedItem analyze(ImportSource.NzbFile source, MetaType metaType) {
        return analyzeContent(source.content(), null);
    }

    AnalyzedItem analyzeContent(String content, String sourceUrl) {
        NzbDocument nzb = NzbParser.parse(content);
        List<FileEntry> files = new ArrayList<>();
        for (NzbDocument.NzbFile file : nzb.files()) {
            files.add(SourceFiles.entry(files.size(), file.filename(), file.bytes()));
        }
        // archive-only posts: the main volumes stand in for the video
        if (files.stream().noneMatch(FileEntry::included)) {
            List<FileEntry> withArchives = new ArrayList<>();
            for (FileEntry f : files) {
                boolean main = MAIN_ARCHIVE.matcher(f.filename()).find() && !SourceFiles.isSample(f.filename());
                withArchives.add(main ? f.withIncluded(true) : f);
            }
            files = withArchives;
        }

        String displayName = nzb.title() != null ? nzb.title() : fallbackName(nzb, files);
        ReleaseNameParser.Parsed parsed = ReleaseNameParser.parse(displayName);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("groups", nzb.groups());
        String poster = nzb.files().get(0).poster();
        if (poster != null) {
            attributes.put("poster", poster);
        }
        if (nzb.password() != null) {
            attributes.put("password", nzb.password());
        }
        if (nzb.category() != null) {
            attributes.put("category", nzb.category());
        }
        if (sourceUrl != null) {
            attributes.put("nzb_url", sourceUrl);
        }
        return new AnalyzedItem(SourceKind.NZB, nzb.guid(), displayName, parsed.title(), parsed.year(),
                parsed.release(), nzb.totalBytes(), files, List.of(), attributes);
    }

    private static String fallbackName(NzbDocument nzb, List<FileEntry> files) {
        return files.stream()
                .filter(FileEntry::included)
                .max(Comparator.comparingLong(FileEntry::size))
                .or(() -> files.stream().max(Comparator.comparingLong(FileEntry::size)))
                .map(f -> stripExtension(SourceFiles.baseName(f.filename())))
                .orElse(nzb.files().get(0).subject());
    }

    private static String stripExtension(String name) {
        String stripped = name.replaceAll("(?i)\\.part\\d+\\.rar$", "");
        if (!stripped.equals(name)) {
            return stripped;
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
