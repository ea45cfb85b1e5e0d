package com.example.catalog_import.dto;

/**
 * One file inside a multi-file source. Season and episode stay {@code null} until a filename
 * heuristic or the user assigns them.
 */
public record FileEntry(
        int index,
        String filename,
        long size,
        Integer season,
        Integer episode,
        Integer episodeEnd,
        boolean included,
        String metaId
) {
    public static FileEntry of(int index, String filename, long size) {
        return new FileEntry(index, filename, size, null, null, null, true, null);
    }

    public FileEntry withAssignment(Integer season, Integer episode, Integer episodeEnd) {
        return new FileEntry(index, filename, size, season, episode, episodeEnd, included, metaId);
    }

    public FileEntry withSeason(Integer season) {
        return new FileEntry(index, filename, size, season, episode, episodeEnd, included, metaId);
    }

    public FileEntry withIncluded(boolean included) {
        return new FileEntry(index, filename, size, season, episode, episodeEnd, included, metaId);
    }

    public FileEntry withMetaId(String metaId) {
        return new FileEntry(index, filename, size, season, episode, episodeEnd, included, metaId);
    }

    public boolean hasEpisodeInfo() {
        return season != null && episode != null;
    }
}
