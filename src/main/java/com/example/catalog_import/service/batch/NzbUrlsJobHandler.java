package com.example.catalog_import.service.batch;

import com.example.catalog_import.dto.ImportOutcome;
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

/**
 * Imports each queued NZB URL with the best catalog match. Anything that would need a client decision
 * (annotation, validation override, ambiguous match) counts as failed.
 */
@Component
public class NzbUrlsJobHandler implements ImportJobHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(NzbUrlsJobHandler.class);

    private final ImportPipeline pipeline;

    public NzbUrlsJobHandler(ImportPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public ImportJobType type() {
        return ImportJobType.NZB_URLS;
    }

    @Override
    public List<String> statKeys() {
        return BatchOutcomes.STAT_KEYS;
    }

    @Override
    public void run(ImportJobView job, JobProgress progress) {
        MetaType metaType = MetaType.fromId(String.valueOf(job.payload().getOrDefault("meta_type", "movie")));
        for (String url : urls(job)) {
            try {
                ImportOutcome outcome = pipeline.importContent(
                        ImportRequest.batch(new ImportSource.NzbUrl(url), metaType));
                String key = BatchOutcomes.statKey(outcome);
                if (BatchOutcomes.FAILED.equals(key)) {
                    LOGGER.info("NZB batch item not imported job={} url={} status={} message={}", job.id(), url,
                            outcome.status(), outcome.message());
                }
                progress.record(key);
            } catch (RuntimeException ex) {
                LOGGER.warn("NZB batch item failed job={} url={}: {}", job.id(), url, ex.getMessage());
                progress.record(BatchOutcomes.FAILED);
            }
        }
    }

    private static List<String> urls(ImportJobView job) {
        Object raw = job.payload().get("urls");
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
