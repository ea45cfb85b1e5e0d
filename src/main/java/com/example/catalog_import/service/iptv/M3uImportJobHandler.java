package com.example.catalog_import.service.iptv;

import com.example.catalog_import.service.importer.PlaylistItem;
import com.example.catalog_import.service.job.ImportJobHandler;
import com.example.catalog_import.service.job.ImportJobView;
import com.example.catalog_import.service.job.JobProgress;
import com.example.catalog_import.util.ImportJobType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class M3uImportJobHandler implements ImportJobHandler {
    private final M3uImportService importService;
    private final IptvSourceService sourceService;

    public M3uImportJobHandler(M3uImportService importService, IptvSourceService sourceService) {
        this.importService = importService;
        this.sourceService = sourceService;
    }

    @Override
    public ImportJobType type() {
        return ImportJobType.M3U;
    }

    @Override
    public List<String> statKeys() {
        return M3uImportService.STAT_KEYS;
    }

    @Override
    public void run(ImportJobView job, JobProgress progress) {
        List<PlaylistItem> items = importService.readPayload(job.payload());
        importService.importEntries(items, job.sourceId(), progress);
        sourceService.recordSync(job.sourceId(), progress.stats());
    }
}
