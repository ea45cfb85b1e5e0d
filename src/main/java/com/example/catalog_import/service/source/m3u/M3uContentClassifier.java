package com.example.catalog_import.service.source.m3u;

import com.example.catalog_import.util.M3uContentType;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies playlist entries as tv, movie or series without touching the stream URL. Signals in order:
 * episode markers in the title, a parenthesized year, group keywords, URL path segments, URL extension.
 */
public final class M3uContentClassifier {

    public record Classification(M3uContentType type, String title, Integer year, Integer season, Integer episode) {}

    private static final List<String> SERIES_KEYWORDS = List.of(
            "series", "shows", "tv show", "tv shows", "episode", "season", "vod series", "drama", "sitcom");
    private static final List<String> MOVIE_KEYWORDS = List.of(
            "movie", "movies", "film", "films", "cinema", "vod movie", "hd movies", "4k movies");
    private static final List<String> TV_KEYWORDS = List.of(
            "live", "tv", "channel", "channels", "news", "sports", "24/7", "radio", "entertainment", "music", "kids",
            "documentary", "general");

    private static final Set<String> LIVE_EXTENSIONS = Set.of("m3u8", "ts", "mpd");
    private static final Set<String> VOD_EXTENSIONS = Set.of("mp4", "mkv", "avi", "webm", "mov", "wmv", "flv");

    private static final Pattern SXXEYY = Pattern.compile("(?i)\\bS(\\d{1,2})\\s*E(\\d{1,3})\\b");
    private static final Pattern NXNN = Pattern.compile("(?i)\\b(\\d{1,2})x(\\d{1,3})\\b");
    private static final Pattern VERBOSE = Pattern.compile("(?i)\\bseason\\s*(\\d{1,2})\\s*episode\\s*(\\d{1,3})\\b");
    private static final Pattern BARE_EPISODE = Pattern.compile("(?i)\\bE(\\d{1,3})\\b");
    private static final Pattern YEAR = Pattern.compile("[(\\[.]?((?:19|20)\\d{2})[)\\].]?");
    private static final Pattern PAREN_YEAR = Pattern.compile("[(\\[]((?:19|20)\\d{2})[)\\]]");

    private M3uContentClassifier() {
    }

    public static Classification classify(String name, String groupTitle, String url) {
        String title = name == null ? "" : name.trim();

        Integer season = null;
        Integer episode = null;
        int markerStart = -1;
        Matcher m;
        if ((m = SXXEYY.matcher(title)).find() || (m = NXNN.matcher(title)).find() || (m = VERBOSE.matcher(title)).find()) {
            season = Integer.parseInt(m.group(1));
            episode = Integer.parseInt(m.group(2));
            markerStart = m.start();
        } else if ((m = BARE_EPISODE.matcher(title)).find()) {
            season = 1;
            episode = Integer.parseInt(m.group(1));
            markerStart = m.start();
        }

        Integer year = null;
        int yearStart = -1;
        Matcher ym = YEAR.matcher(title);
        while (ym.find()) {
            if (ym.start() > 0) {
                year = Integer.parseInt(ym.group(1));
                yearStart = ym.start();
                break;
            }
        }
        String parsedTitle = cleanTitle(title, markerStart, yearStart);

        if (episode != null) {
            return new Classification(M3uContentType.SERIES, parsedTitle, year, season, episode);
        }
        if (PAREN_YEAR.matcher(title).find()) {
            return new Classification(M3uContentType.MOVIE, parsedTitle, year, null, null);
        }
        M3uContentType byGroup = fromGroup(groupTitle);
        if (byGroup != M3uContentType.UNKNOWN) {
            return new Classification(byGroup, parsedTitle, year, byGroup == M3uContentType.SERIES ? 1 : null,
                    byGroup == M3uContentType.SERIES ? 1 : null);
        }
        M3uContentType byUrl = fromUrl(url);
        return new Classification(byUrl, parsedTitle, year, byUrl == M3uContentType.SERIES ? 1 : null,
                byUrl == M3uContentType.SERIES ? 1 : null);
    }

    static M3uContentType fromGroup(String groupTitle) {
        if (groupTitle == null || groupTitle.isBlank()) {
            return M3uContentType.UNKNOWN;
        }
        String group = groupTitle.toLowerCase(Locale.ROOT);
        if (containsKeyword(group, SERIES_KEYWORDS)) {
            return M3uContentType.SERIES;
        }
        if (containsKeyword(group, MOVIE_KEYWORDS)) {
            return M3uContentType.MOVIE;
        }
        if (containsKeyword(group, TV_KEYWORDS)) {
            return M3uContentType.TV;
        }
        return M3uContentType.UNKNOWN;
    }

    static M3uContentType fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return M3uContentType.UNKNOWN;
        }
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException ex) {
            path = url;
        }
        path = path == null ? "" : path.toLowerCase(Locale.ROOT);
        if (path.contains("/series/")) {
            return M3uContentType.SERIES;
        }
        if (path.contains("/movie/") || path.contains("/movies/")) {
            return M3uContentType.MOVIE;
        }
        if (path.contains("/live/") || path.contains("/tv/") || path.contains("/channel/")) {
            return M3uContentType.TV;
        }
        int dot = path.lastIndexOf('.');
        String ext = dot >= 0 ? path.substring(dot + 1) : "";
        if (LIVE_EXTENSIONS.contains(ext)) {
            return M3uContentType.TV;
        }
        if (VOD_EXTENSIONS.contains(ext)) {
            return M3uContentType.MOVIE;
        }
        return M3uContentType.UNKNOWN;
    }

    private static boolean containsKeyword(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword) + "(?![a-z0-9])").matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static String cleanTitle(String title, int markerStart, int yearStart) {
        int end = title.length();
        if (markerStart > 0) {
            end = Math.min(end, markerStart);
        }
        if (yearStart > 0) {
            end = Math.min(end, yearStart);
        }
        String cleaned = title.substring(0, end).replaceAll("[._]", " ").replaceAll("\\s+", " ").trim();
        cleaned = cleaned.replaceAll("[\\s\\-:|(\\[]+$", "").trim();
        return cleaned.isEmpty() ? title : cleaned;
    }
}
