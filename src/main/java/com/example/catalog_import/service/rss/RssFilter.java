package com.example.catalog_import.service.rss;

import com.example.catalog_import.model.UserRssFeed;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Include/exclude regex and size bounds of a feed. Patterns match anywhere in the title, case-insensitively.
 * An item of unknown size passes the size bounds.
 */
public final class RssFilter {
    private final Pattern include;
    private final Pattern exclude;
    private final Long minSize;
    private final Long maxSize;

    private RssFilter(Pattern include, Pattern exclude, Long minSize, Long maxSize) {
        this.include = include;
        this.exclude = exclude;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    public static RssFilter of(UserRssFeed feed) {
        return new RssFilter(compile(feed.getIncludePattern()), compile(feed.getExcludePattern()),
                feed.getMinSizeBytes(), feed.getMaxSizeBytes());
    }

    public boolean accepts(RssItem item) {
        String title = item.title() == null ? "" : item.title();
        if (item.link() == null || item.link().isBlank()) {
            return false;
        }
        if (include != null && !include.matcher(title).find()) {
            return false;
        }
        if (exclude != null && exclude.matcher(title).find()) {
            return false;
        }
        if (item.size() != null) {
            if (minSize != null && item.size() < minSize) {
                return false;
            }
            if (maxSize != null && item.size() > maxSize) {
                return false;
            }
        }
        return true;
    }

    static Pattern compile(String regex) {
        if (regex == null || regex.isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_PATTERN", ex);
        }
    }
}
