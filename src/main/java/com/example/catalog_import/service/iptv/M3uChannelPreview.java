package com.example.catalog_import.service.iptv;

import com.example.catalog_import.dto.Match;
import com.example.catalog_import.util.M3uContentType;

import java.util.List;

public record M3uChannelPreview(
        int index,
        String name,
        String url,
        String logo,
        List<String> genres,
        String country,
        M3uContentType detectedType,
        Match matchedMedia,
        Integer season,
        Integer episode,
        String parsedTitle,
        Integer parsedYear
) {
}
