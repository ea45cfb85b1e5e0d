package com.example.catalog_import.service.source;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Raw import input, one variant per source kind. The JSON form carries a {@code kind} discriminator, so a
 * request can never hold, say, a magnet link and a torrent file at the same time.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ImportSource.Magnet.class, name = "magnet"),
        @JsonSubTypes.Type(value = ImportSource.TorrentFile.class, name = "torrent_file"),
        @JsonSubTypes.Type(value = ImportSource.TorrentUrl.class, name = "torrent_url"),
        @JsonSubTypes.Type(value = ImportSource.NzbFile.class, name = "nzb_file"),
        @JsonSubTypes.Type(value = ImportSource.NzbUrl.class, name = "nzb_url"),
        @JsonSubTypes.Type(value = ImportSource.YouTube.class, name = "youtube"),
        @JsonSubTypes.Type(value = ImportSource.Http.class, name = "http"),
        @JsonSubTypes.Type(value = ImportSource.AceStream.class, name = "acestream"),
        @JsonSubTypes.Type(value = ImportSource.AnalysisHandle.class, name = "analysis_handle")
})
public interface ImportSource {

    record Magnet(String magnetLink) implements ImportSource {}

    /** Raw {@code .torrent} bytes; base64 in JSON. */
    record TorrentFile(byte[] content, String filename) implements ImportSource {}

    record TorrentUrl(String url) implements ImportSource {}

    record NzbFile(String content, String filename) implements ImportSource {}

    record NzbUrl(String url) implements ImportSource {}

    /** Watch/shorts/youtu.be URL or a bare 11 character video id. */
    record YouTube(String url) implements ImportSource {}

    record Http(String url, String name) implements ImportSource {}

    /** 40 hex content id or an {@code acestream://} URL. */
    record AceStream(String contentId, String name) implements ImportSource {}

    /** Reference to an analysis cached by a previous analyze call. */
    record AnalysisHandle(String handle) implements ImportSource {}
}
