package com.example.catalog_import.service.iptv;

import com.example.catalog_import.model.IptvSource;
import com.example.catalog_import.service.importer.PlaylistItem;
import com.example.catalog_import.service.job.ImportJobHandler;
import com.example.catalog_import.service.job.ImportJobView;
import com.example.catalog_import.service.job.JobProgress;
import com.example.catalog_import.service.source.m3u.M3uParser;
import com.example.catalog_import.service.source.web.SourceFetcher;
import com.example.catalog_import.service.source.xtream.XtreamCatalog;
import com.example.catalog_import.service.source.xtream.XtreamClient;
import com.example.catalog_import.service.source.xtream.XtreamCredentials;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.IptvSourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Re-imports a saved source. Streams that already exist are refreshed and counted as skipped.
 */
@Component
public class IptvSyncJobHandler implements ImportJobHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(IptvSyncJobHandler.class);

    private final IptvSourceService sourceService;
    private final SourceFetcher fetcher;
    private final XtreamClient xtreamClient;
    private final M3uImportService m3uImportService;
    private final XtreamImportService xtreamImportService;

    public IptvSyncJobHandler(IptvSourceService sourceService,
                              SourceFetcher fetcher,
                              XtreamClient xtreamClient,
                              M3uImportService m3uImportService,
                              XtreamImportService xtreamImportService) {
        this.sourceService = sourceService;
        this.fetcher = fetcher;
        this.xtreamClient = xtreamClient;
        this.m3uImportService = m3uImportService;
        this.xtreamImportService = xtreamImportService;
    }

    @Override
    public ImportJobType type() {
        return ImportJobType.IPTV_SYNC;
    }

    @Override
    public List<String> statKeys() {
        return M3uImportService.STAT_KEYS;
    }

    @Override
    public void run(ImportJobView job, JobProgress progress) {
        if (job.sourceId() == null) {
            throw new IllegalStateException("Sync job has no source");
        }
        IptvSource source = sourceService.get(job.sourceId());
        if (source.getSourceType() == IptvSourceType.M3U) {
            List<PlaylistItem> items = M3uImportService.toItems(M3uParser.parse(fetcher.fetchString(source.getM3uUrl())))
                    .stream()
                    .filter(item -> wanted(source, item))
                    .toList();
            progress.addTotal(items.size());
            m3uImportService.importEntries(items, source.getId(), progress);
        } else {
            XtreamCredentials credentials = new XtreamCredentials(source.getServer(), source.getUsername(),
                    source.getPassword());
            XtreamSelection selection = new XtreamSelection(source.isImportLive(), source.isImportVod(),
                    source.isImportSeries(), source.getLiveCategoryIds(), source.getVodCategoryIds(),
                    source.getSeriesCategoryIds());
            XtreamCatalog catalog = xtreamClient.fetchCatalog(credentials);
            progress.addTotal(XtreamImportService.selectedCount(catalog, selection));
            xtreamImportService.importCatalog(catalog, selection, source.getId(), progress);
        }
        sourceService.recordSync(source.getId(), progress.stats());
        LOGGER.info("IPTV SYNC source={} type={} stats={}", source.getId(), source.getSourceType(), progress.stats());
    }

    private static boolean wanted(IptvSource source, PlaylistItem item) {
        return switch (item.type()) {
            case TV -> source.isImportLive();
            case MOVIE -> source.isImportVod();
            case SERIES -> source.isImportSeries();
            case UNKNOWN -> true;
        };
    }
}
