package com.example.catalog_import.service.source.xtream;

public record XtreamEpisode(String id, int season, int episode, String title, String containerExtension) {
}
