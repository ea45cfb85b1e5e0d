package com.example.catalog_import.service.source.xtream;

import com.example.catalog_import.service.source.AnalysisException;
import com.example.catalog_import.service.source.web.SourceFetcher;

/**
 * Panel address plus login. {@link #baseUrl()} strips a trailing {@code /player_api.php}.
 */
public record XtreamCredentials(String serverUrl, String username, String password) {

    public XtreamCredentials {
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            throw AnalysisException.malformed("Xtream username and password are required");
        }
        SourceFetcher.requireHttpUrl(serverUrl);
        serverUrl = serverUrl.trim();
    }

    public String baseUrl() {
        String base = serverUrl;
        int api = base.indexOf("/player_api");
        if (api >= 0) {
            base = base.substring(0, api);
        }
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    public String apiUrl() {
        return baseUrl() + "/player_api.php";
    }
}
