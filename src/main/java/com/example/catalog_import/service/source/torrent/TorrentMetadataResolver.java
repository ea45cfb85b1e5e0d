package com.example.catalog_import.service.source.torrent;

import java.util.Optional;

/**
 * Fetches the metadata of a magnet link's torrent. Implementations must return within their timeout and
 * report "not available" as an empty result rather than failing.
 */
public interface TorrentMetadataResolver {
    Optional<TorrentMetainfo> resolve(String infoHash);
}
