package com.example.catalog_import.service.match;

import com.example.catalog_import.dto.Match;
import com.example.catalog_import.util.MetaType;

import java.util.List;
import java.util.Optional;

/**
 * External metadata source consulted by the matcher and when a selected external id is not catalogued yet.
 */
public interface MetadataSearchProvider {

    /** Candidates for a title; returned matches carry no confidence yet. */
    List<Match> search(String title, Integer year, MetaType type);

    Optional<MediaDraft> fetch(String externalId, MetaType type);
}
