package com.example.catalog_import.util;

import com.example.catalog_import.dto.ReleaseInfo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers title, year, episode markers and technical tags from scene-style release names such as
 * {@code The.Show.S01E02.1080p.WEB-DL.DDP5.1.H.264-GROUP.mkv}.
 */
public final class ReleaseNameParser {

    public record Parsed(
            String title,
            Integer year,
            Integer season,
            Integer episode,
            Integer episodeEnd,
            ReleaseInfo release
    ) {
        public boolean hasEpisode() {
            return season != null && episode != null;
        }
    }

    public static final Set<String> VIDEO_EXTENSIONS = Set.of(
            "mkv", "mp4", "avi", "mov", "wmv", "flv", "webm", "m4v", "mpg", "mpeg", "ts", "m2ts", "vob");

    private static final Pattern EXTENSION = Pattern.compile("\\.([A-Za-z0-9]{2,4})$");
    private static final Pattern LEADING_TAG = Pattern.compile("^\\s*\\[([^\\]]+)]\\s*");

    private static final Pattern SXXEYY = Pattern.compile(
            "(?i)(?<![a-z0-9])S(\\d{1,2})[ ._-]?E(\\d{1,3})(?:[ ._-]?-?[ ._-]?E(\\d{1,3}))?(?![0-9])");
    private static final Pattern NXNN = Pattern.compile("(?i)(?<![a-z0-9])(\\d{1,2})x(\\d{2,3})(?![0-9])");
    private static final Pattern VERBOSE = Pattern.compile(
            "(?i)\\bseason[ ._-]*(\\d{1,2})[ ._-]*(?:episode|ep)[ ._-]*(\\d{1,3})\\b");
    private static final Pattern SEASON_ONLY = Pattern.compile("(?i)(?<![a-z0-9])(?:S(\\d{1,2})|season[ ._-]*(\\d{1,2}))(?![0-9])(?![ ._-]?E\\d)");
    private static final Pattern BARE_EPISODE = Pattern.compile("(?i)(?<![a-z0-9])EP?(\\d{1,3})(?![a-z0-9])");
    private static final Pattern YEAR = Pattern.compile("(?<![0-9])((?:19|20)\\d{2})(?![0-9]|p)");

    private static final Pattern RESOLUTION = Pattern.compile("(?i)(?<![a-z0-9])(2160|1440|1080|720|576|480|360)[pi](?![a-z0-9])");
    private static final Pattern UHD = Pattern.compile("(?i)(?<![a-z0-9])(4k|uhd)(?![a-z0-9])");

    private static final Map<String, Pattern> QUALITY = orderedPatterns(
            "REMUX", "remux",
            "BluRay", "blu-?ray|bdrip|brrip|bdmv",
            "WEB-DL", "web-?dl",
            "WEBRip", "web-?rip",
            "WEB", "web",
            "HDTV", "hdtv|pdtv",
            "DVDRip", "dvd-?rip|dvd",
            "HDRip", "hd-?rip",
            "SCR", "dvdscr|screener|scr",
            "TS", "telesync|hdts|ts",
            "CAM", "hdcam|cam");

    private static final Map<String, Pattern> CODEC = orderedPatterns(
            "HEVC", "x265|h\\.?265|hevc",
            "H.264", "x264|h\\.?264|avc",
            "AV1", "av1",
            "XviD", "xvid|divx",
            "VP9", "vp9");

    private static final Map<String, Pattern> AUDIO = orderedPatterns(
            "Atmos", "atmos",
            "TrueHD", "truehd",
            "DTS-HD MA", "dts-?hd[ .-]?ma",
            "DTS", "dts(?!-?hd)",
            "DD+", "ddp(?:[ .]?\\d\\.\\d)?|dd\\+|e-?ac-?3",
            "DD", "dd(?:[ .]?\\d\\.\\d)|ac3",
            "AAC", "aac(?:[ .]?\\d\\.\\d)?",
            "FLAC", "flac",
            "Opus", "opus",
            "MP3", "mp3");

    private static final Map<String, Pattern> HDR = orderedPatterns(
            "DV", "dv|dovi|dolby[ .]?vision",
            "HDR10+", "hdr10\\+|hdr10plus",
            "HDR10", "hdr10(?!\\+|plus)",
            "HDR", "hdr",
            "HLG", "hlg");

    private static final Map<String, Pattern> LANGUAGES = orderedPatterns(
            "multi", "multi|dual",
            "fr", "french|truefrench|vff|vfq|vf2|vostfr",
            "en", "eng|english",
            "de", "ger|german",
            "it", "ita|italian",
            "es", "spa|spanish|esp|castellano|latino",
            "ja", "jap|japanese",
            "ko", "kor|korean",
            "ru", "rus|russian",
            "hi", "hin|hindi",
            "pt", "por|portuguese|dublado");

    private static final Set<String> NOT_A_GROUP = Set.of("DL", "RIP", "HD", "MA", "X", "AC3", "DTS");

    private ReleaseNameParser() {
    }

    public static Parsed parse(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return new Parsed(null, null, null, null, null, ReleaseInfo.empty());
        }
        String name = stripVideoExtension(rawName.trim());
        String leadingGroup = null;
        Matcher tag = LEADING_TAG.matcher(name);
        if (tag.find()) {
            leadingGroup = tag.group(1).trim();
            name = name.substring(tag.end());
        }

        Integer season = null;
        Integer episode = null;
        Integer episodeEnd = null;
        int titleEnd = name.length();

        Matcher m = SXXEYY.matcher(name);
        if (m.find()) {
            season = Integer.parseInt(m.group(1));
            episode = Integer.parseInt(m.group(2));
            episodeEnd = m.group(3) != null ? Integer.parseInt(m.group(3)) : null;
            titleEnd = Math.min(titleEnd, m.start());
        } else if ((m = NXNN.matcher(name)).find()) {
            season = Integer.parseInt(m.group(1));
            episode = Integer.parseInt(m.group(2));
            titleEnd = Math.min(titleEnd, m.start());
        } else if ((m = VERBOSE.matcher(name)).find()) {
            season = Integer.parseInt(m.group(1));
            episode = Integer.parseInt(m.group(2));
            titleEnd = Math.min(titleEnd, m.start());
        } else if ((m = SEASON_ONLY.matcher(name)).find() && m.start() > 0) {
            season = Integer.parseInt(m.group(1) != null ? m.group(1) : m.group(2));
            titleEnd = Math.min(titleEnd, m.start());
        } else if ((m = BARE_EPISODE.matcher(name)).find() && m.start() > 0) {
            // a bare episode marker implies the first season
            season = 1;
            episode = Integer.parseInt(m.group(1));
            titleEnd = Math.min(titleEnd, m.start());
        }
        if (episodeEnd != null && episode != null && episodeEnd <= episode) {
            episodeEnd = null;
        }

        String resolution = null;
        m = RESOLUTION.matcher(name);
        if (m.find()) {
            resolution = m.group(1) + "p";
            titleEnd = startIfPositive(titleEnd, m.start());
        } else if ((m = UHD.matcher(name)).find()) {
            resolution = "2160p";
            titleEnd = startIfPositive(titleEnd, m.start());
        }

        String quality = null;
        for (Map.Entry<String, Pattern> entry : QUALITY.entrySet()) {
            Matcher qm = entry.getValue().matcher(name);
            if (qm.find()) {
                quality = entry.getKey();
                titleEnd = startIfPositive(titleEnd, qm.start());
                break;
            }
        }
        String codec = null;
        for (Map.Entry<String, Pattern> entry : CODEC.entrySet()) {
            Matcher cm = entry.getValue().matcher(name);
            if (cm.find()) {
                codec = entry.getKey();
                titleEnd = startIfPositive(titleEnd, cm.start());
                break;
            }
        }

        Integer year = null;
        Matcher ym = YEAR.matcher(name);
        int yearStart = -1;
        while (ym.find()) {
            if (ym.start() == 0 || ym.start() > titleEnd) {
                continue;
            }
            year = Integer.parseInt(ym.group(1));
            yearStart = ym.start();
        }
        if (yearStart > 0) {
            titleEnd = Math.min(titleEnd, yearStart);
        }

        String title = cleanTitle(name.substring(0, titleEnd));
        String tail = name.substring(Math.min(titleEnd, name.length()));
        ReleaseInfo release = new ReleaseInfo(
                resolution,
                quality,
                codec,
                collect(AUDIO, tail),
                collect(HDR, tail),
                collect(LANGUAGES, tail),
                releaseGroup(name, leadingGroup));
        return new Parsed(title.isEmpty() ? null : title, year, season, episode, episodeEnd, release);
    }

    public static boolean isVideoFile(String filename) {
        String ext = extension(filename);
        return ext != null && VIDEO_EXTENSIONS.contains(ext);
    }

    public static String extension(String filename) {
        if (filename == null) {
            return null;
        }
        Matcher m = EXTENSION.matcher(filename);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : null;
    }

    private static String stripVideoExtension(String name) {
        String base = name.replace('\\', '/');
        int slash = base.lastIndexOf('/');
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        return isVideoFile(base) ? base.substring(0, base.lastIndexOf('.')) : base;
    }

    private static int startIfPositive(int current, int start) {
        return start > 0 ? Math.min(current, start) : current;
    }

    private static String cleanTitle(String raw) {
        String spaced = raw.replace('.', ' ').replace('_', ' ');
        spaced = spaced.replaceAll("[\\[(]\\s*$", "");
        spaced = spaced.replaceAll("\\s+", " ").trim();
        return spaced.replaceAll("[\\s\\-\\[(]+$", "").trim();
    }

    private static List<String> collect(Map<String, Pattern> patterns, String text) {
        Set<String> found = new LinkedHashSet<>();
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                found.add(entry.getKey());
            }
        }
        return new ArrayList<>(found);
    }

    private static String releaseGroup(String name, String leadingGroup) {
        int dash = name.lastIndexOf('-');
        if (dash >= 0 && dash < name.length() - 1) {
            String candidate = name.substring(dash + 1).trim();
            if (candidate.matches("[A-Za-z0-9]{2,}") && !NOT_A_GROUP.contains(candidate.toUpperCase(Locale.ROOT))) {
                return candidate;
            }
        }
        return leadingGroup;
    }

    private static Map<String, Pattern> orderedPatterns(String... labelAndRegex) {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (int i = 0; i + 1 < labelAndRegex.length; i += 2) {
            patterns.put(labelAndRegex[i],
                    Pattern.compile("(?i)(?<![a-z0-9])(?:" + labelAndRegex[i + 1] + ")(?![a-z0-9])"));
        }
        return patterns;
    }
}
