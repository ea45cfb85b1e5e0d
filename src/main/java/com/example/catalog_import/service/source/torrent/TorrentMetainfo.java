package com.example.catalog_import.service.source.torrent;

import com.example.catalog_import.dto.FileEntry;

import java.util.List;

/**
 * Decoded {@code .torrent} metadata.
 *
 * @param infoHash lower-case hex SHA-1 of the bencoded {@code info} dictionary
 */
public record TorrentMetainfo(
        String infoHash,
        String name,
        List<FileEntry> files,
        long totalSize,
        List<String> trackers,
        boolean privateTorrent,
        String comment,
        String createdBy
) {
}
