package com.example.catalog_import.service.rss;

import com.example.catalog_import.util.MetaType;

/** One candidate posted by an external feed scraper. {@code size} is in bytes and may be unknown. */
public record RssItem(String title, String link, Long size, MetaType metaType) {
}
