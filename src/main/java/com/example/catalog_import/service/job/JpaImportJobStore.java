package com.example.catalog_import.service.job;

import com.example.catalog_import.model.ImportJob;
import com.example.catalog_import.repository.ImportJobRepository;
import com.example.catalog_import.util.ImportJobStatus;
import com.example.catalog_import.util.ImportJobType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class JpaImportJobStore implements ImportJobStore {
    private final ImportJobRepository jobRepo;
    private final ObjectMapper mapper;

    public JpaImportJobStore(ImportJobRepository jobRepo, ObjectMapper mapper) {
        this.jobRepo = jobRepo;
        this.mapper = mapper;
    }

    @Override
    @Transactional
    public UUID create(ImportJobType type, int total, Map<String, Object> payload, UUID sourceId) {
        ImportJob job = new ImportJob(type);
        job.setStatus(ImportJobStatus.QUEUED);
        job.setTotal(Math.max(0, total));
        job.setPayload(payload == null ? Map.of() : payload);
        job.setSourceId(sourceId);
        jobRepo.save(job);
        return job.getId();
    }

    @Override
    @Transactional
    public List<ImportJobView> claimQueued(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<UUID> ids = jobRepo.selectQueuedIdsForUpdate(limit);
        if (ids.isEmpty()) {
            return List.of();
        }
        int updated = jobRepo.markProcessingBatch(ids);
        if (updated <= 0) {
            return List.of();
        }

        Map<UUID, Integer> order = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            order.put(ids.get(i), i);
        }
        List<ImportJob> jobs = new ArrayList<>(jobRepo.findAllById(ids));
        jobs.sort(Comparator.comparingInt(j -> order.getOrDefault(j.getId(), Integer.MAX_VALUE)));

        List<ImportJobView> views = new ArrayList<>(jobs.size());
        for (ImportJob job : jobs) {
            job.setStatus(ImportJobStatus.PROCESSING);
            views.add(toView(job));
        }
        return views;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void updateProgress(UUID id, int progress, int total, Map<String, Integer> stats) {
        jobRepo.updateProgress(id, progress, total, json(stats));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void complete(UUID id, int processed, Map<String, Integer> stats) {
        jobRepo.markCompleted(id, processed, json(stats));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void fail(UUID id, String error, Map<String, Integer> stats) {
        jobRepo.markFailed(id, error == null ? "unknown" : error, json(stats));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean cancelQueued(UUID id, String reason) {
        return jobRepo.cancelQueued(id, reason) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ImportJobView> get(UUID id) {
        return jobRepo.findById(id).map(JpaImportJobStore::toView);
    }

    private String json(Map<String, Integer> stats) {
        try {
            return mapper.writeValueAsString(stats == null ? Map.of() : stats);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serialize job stats failed", e);
        }
    }

    private static ImportJobView toView(ImportJob job) {
        return new ImportJobView(job.getId(), job.getType(), job.getStatus(), job.getProgress(), job.getTotal(),
                job.getStats() == null ? Map.of() : new LinkedHashMap<>(job.getStats()), job.getPayload(),
                job.getError(), job.getSourceId(), job.getCreatedAt(), job.getUpdatedAt());
    }
}
