package com.example.catalog_import.service.rss;

import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.service.batch.BatchOutcomes;
import com.example.catalog_import.service.importer.ImportPipeline;
import com.example.catalog_import.service.importer.ImportRequest;
import com.example.catalog_import.service.job.ImportJobHandler;
import com.example.catalog_import.service.job.ImportJobView;
import com.example.catalog_import.service.job.JobProgress;
import com.example.catalog_import.service.source.ImportSource;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.MetaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class RssImportJobHandler implements ImportJobHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(RssImportJobHandler.class);

    private final ImportPipeline pipeline;

    public RssImportJobHandler(ImportPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public ImportJobType type() {
        return ImportJobType.RSS;
    }

    @Override
    public List<String> statKeys() {
        return BatchOutcomes.STAT_KEYS;
    }

    @Override
    public void run(ImportJobView job, JobProgress progress) {
        Object raw = job.payload().get("items");
        if (!(raw instanceof List<?> items)) {
            return;
        }
        for (Object element : items) {
            if (!(element instanceof Map<?, ?> item) || item.get("link") == null) {
                progress.record(BatchOutcomes.FAILED);
                continue;
            }
            String link = String.valueOf(item.get("link"));
            try {
                MetaType metaType = MetaType.fromId(String.valueOf(item.get("meta_type")));
                ImportOutcome outcome = pipeline.importContent(ImportRequest.batch(sourceFor(link), metaType));
                progress.record(BatchOutcomes.statKey(outcome));
            } catch (RuntimeException ex) {
                LOGGER.warn("RSS item failed job={} link={}: {}", job.id(), link, ex.getMessage());
                progress.record(BatchOutcomes.FAILED);
            }
        }
    }

    /** Magnet links, NZB downloads and everything else as a {@code .torrent} download. */
    static ImportSource sourceFor(String link) {
        String lower = link.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("magnet:")) {
            return new ImportSource.Magnet(link.trim());
        }
        String path = lower.contains("?") ? lower.substring(0, lower.indexOf('?')) : lower;
        if (path.endsWith(".nzb")) {
            return new ImportSource.NzbUrl(link.trim());
        }
        return new ImportSource.TorrentUrl(link.trim());
    }
}
