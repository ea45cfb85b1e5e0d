package com.example.catalog_import.service.iptv;

import com.example.catalog_import.service.job.ImportJobHandler;
import com.example.catalog_import.service.job.ImportJobView;
import com.example.catalog_import.service.job.JobProgress;
import com.example.catalog_import.service.source.xtream.XtreamCatalog;
import com.example.catalog_import.service.source.xtream.XtreamClient;
import com.example.catalog_import.service.source.xtream.XtreamCredentials;
import com.example.catalog_import.util.ImportJobType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Background panel import. The catalog is fetched again since cached analyses are not shared with workers.
 */
@Component
public class XtreamImportJobHandler implements ImportJobHandler {
    private final XtreamClient client;
    private final XtreamImportService importService;
    private final IptvSourceService sourceService;
    private final ObjectMapper objectMapper;

    public XtreamImportJobHandler(XtreamClient client, XtreamImportService importService,
                                  IptvSourceService sourceService, ObjectMapper objectMapper) {
        this.client = client;
        this.importService = importService;
        this.sourceService = sourceService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ImportJobType type() {
        return ImportJobType.XTREAM;
    }

    @Override
    public List<String> statKeys() {
        return XtreamImportService.STAT_KEYS;
    }

    @Override
    public void run(ImportJobView job, JobProgress progress) {
        Object rawCredentials = job.payload().get("credentials");
        Object rawSelection = job.payload().get("selection");
        if (rawCredentials == null || rawSelection == null) {
            throw new IllegalStateException("Xtream job payload is missing credentials or selection");
        }
        XtreamCredentials credentials = objectMapper.convertValue(rawCredentials, XtreamCredentials.class);
        XtreamSelection selection = objectMapper.convertValue(rawSelection, XtreamSelection.class);
        XtreamCatalog catalog = client.fetchCatalog(credentials);
        importService.importCatalog(catalog, selection, job.sourceId(), progress);
        sourceService.recordSync(job.sourceId(), progress.stats());
    }
}
