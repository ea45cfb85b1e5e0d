package com.example.catalog_import.service.batch;

import com.example.catalog_import.dto.ImportOutcome;
import com.example.catalog_import.service.job.ImportJobService;
import com.example.catalog_import.util.ImportErrorType;
import com.example.catalog_import.util.ImportJobType;
import com.example.catalog_import.util.MetaType;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Queues a list of NZB URLs as one background job. Blank and repeated URLs are dropped.
 */
@Service
public class NzbBatchService {
    private final ImportJobService jobService;

    public NzbBatchService(ImportJobService jobService) {
        this.jobService = jobService;
    }

    public ImportOutcome enqueue(List<String> urls, MetaType metaType) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        if (urls != null) {
            urls.stream()
                    .filter(url -> url != null && !url.isBlank())
                    .map(String::trim)
                    .forEach(unique::add);
        }
        if (unique.isEmpty()) {
            return ImportOutcome.error(ImportErrorType.MALFORMED_INPUT, "At least one NZB URL is required");
        }
        MetaType type = metaType == null ? MetaType.MOVIE : metaType;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("urls", List.copyOf(unique));
        payload.put("meta_type", type.id());
        UUID jobId = jobService.enqueue(ImportJobType.NZB_URLS, unique.size(), payload, null);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("job_id", jobId);
        details.put("total_items", unique.size());
        details.put("background", true);
        return ImportOutcome.processing(jobId, "Importing " + unique.size() + " NZB files in the background", details);
    }
}
