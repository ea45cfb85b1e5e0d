package com.example.catalog_import.service.source.xtream;

/**
 * The three content trees an Xtream panel may expose.
 */
public enum XtreamContentKind {
    LIVE("live", "get_live_categories", "get_live_streams", "ts"),
    VOD("movie", "get_vod_categories", "get_vod_streams", "mkv"),
    SERIES("series", "get_series_categories", "get_series", "mkv");

    private final String pathSegment;
    private final String categoriesAction;
    private final String streamsAction;
    private final String defaultExtension;

    XtreamContentKind(String pathSegment, String categoriesAction, String streamsAction, String defaultExtension) {
        this.pathSegment = pathSegment;
        this.categoriesAction = categoriesAction;
        this.streamsAction = streamsAction;
        this.defaultExtension = defaultExtension;
    }

    public String pathSegment() {
        return pathSegment;
    }

    public String categoriesAction() {
        return categoriesAction;
    }

    public String streamsAction() {
        return streamsAction;
    }

    public String defaultExtension() {
        return defaultExtension;
    }
}
