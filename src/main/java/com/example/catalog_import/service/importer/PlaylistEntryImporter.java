package com.example.catalog_import.service.importer;

import com.example.catalog_import.dto.AnalyzedItem;
import com.example.catalog_import.dto.FileEntry;
import com.example.catalog_import.dto.ImportResultItem;
import com.example.catalog_import.dto.Match;
import com.example.catalog_import.dto.ReleaseInfo;
import com.example.catalog_import.service.match.CatalogMatcher;
import com.example.catalog_import.service.match.MediaDraft;
import com.example.catalog_import.service.source.SourceFiles;
import com.example.catalog_import.util.MatchConfidence;
import com.example.catalog_import.util.MetaType;
import com.example.catalog_import.util.ResultItemStatus;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Imports playlist and panel entries one at a time. Live channels link to a channel record, movies and
 * episodes to the client's choice, a confident match, or a user-created record. Unclassified entries are
 * skipped.
 */
@Service
public class PlaylistEntryImporter {
    private final StreamImporter streamImporter;
    private final CatalogMatcher matcher;

    public PlaylistEntryImporter(StreamImporter streamImporter, CatalogMatcher matcher) {
        this.streamImporter = streamImporter;
        this.matcher = matcher;
    }

    public ImportResultItem importEntry(PlaylistItem entry, UUID iptvSourceId) {
        if (entry.url() == null || entry.url().isBlank()) {
            return ImportResultItem.failed(null, "Entry " + entry.index() + " has no URL");
        }
        String identity = SourceFiles.urlIdentity(entry.url());
        MetaType metaType = entry.type().toMetaType();
        if (metaType == null) {
            return ImportResultItem.skipped(identity, "content type could not be detected", null);
        }
        String title = entry.title() != null && !entry.title().isBlank() ? entry.title() : entry.name();

        MediaDraft media = switch (metaType) {
            case TV -> StreamImporter.channelMedia(entry.name(), entry.logo());
            case MOVIE, SERIES -> resolveMedia(entry, metaType, title);
        };

        List<FileEntry> files = List.of();
        if (metaType == MetaType.SERIES) {
            int season = entry.season() != null ? entry.season() : 1;
            int episode = entry.episode() != null ? entry.episode() : 1;
            files = List.of(new FileEntry(0, entry.name(), 0L, season, episode, null, true, null));
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("url", entry.url());
        putIfPresent(attributes, "logo", entry.logo());
        putIfPresent(attributes, "group", entry.group());
        if (!entry.genres().isEmpty()) {
            attributes.put("genres", entry.genres());
        }
        AnalyzedItem item = new AnalyzedItem(entry.sourceKind(), identity, entry.name(), title, entry.year(),
                ReleaseInfo.empty(), null, files, List.of(), attributes);
        return streamImporter.commit(new CatalogWrite(item, media, Map.of(), files, iptvSourceId, entry.url()));
    }

    /** Stat key for a result: the content type on success, otherwise {@code skipped} or {@code failed}. */
    public static String statKey(PlaylistItem entry, ImportResultItem result) {
        if (result.status() == ResultItemStatus.SUCCESS) {
            return entry.type().id();
        }
        return result.status() == ResultItemStatus.SKIPPED ? "skipped" : "failed";
    }

    private MediaDraft resolveMedia(PlaylistItem entry, MetaType metaType, String title) {
        if (entry.mediaId() != null && !entry.mediaId().isBlank()) {
            return streamImporter.resolveDraft(entry.mediaId().trim(), metaType, title, entry.year(), entry.logo());
        }
        List<Match> candidates = matcher.match(title, entry.year(), metaType);
        if (!candidates.isEmpty() && candidates.get(0).confidence() != MatchConfidence.FUZZY) {
            Match best = candidates.get(0);
            return streamImporter.resolveDraft(best.externalId(), metaType, best.title(), best.year(), best.posterUrl());
        }
        return StreamImporter.userMedia(metaType, title, entry.year(), entry.logo());
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }
}
