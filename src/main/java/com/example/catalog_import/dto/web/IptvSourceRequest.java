package com.example.catalog_import.dto.web;

import com.example.catalog_import.util.IptvSourceType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record IptvSourceRequest(
        @NotNull IptvSourceType sourceType,
        String name,
        String m3uUrl,
        String serverUrl,
        String username,
        String password,
        boolean isPublic,
        Boolean importLive,
        Boolean importVod,
        Boolean importSeries,
        List<String> liveCategoryIds,
        List<String> vodCategoryIds,
        List<String> seriesCategoryIds
) {

    @AssertTrue(message = "m3u sources need m3u_url, xtream sources need server_url, username and password")
    public boolean isComplete() {
        if (sourceType == IptvSourceType.M3U) {
            return hasText(m3uUrl);
        }
        return hasText(serverUrl) && hasText(username) && hasText(password);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
