package com.example.catalog_import.service.job;

import com.example.catalog_import.util.ImportJobType;

import java.util.List;

/**
 * Runs one kind of background import. Per-item failures are recorded in {@link JobProgress}; an exception
 * fails the whole job.
 */
public interface ImportJobHandler {

    ImportJobType type();

    /** Stat keys reported for this kind of job, in display order. */
    List<String> statKeys();

    void run(ImportJobView job, JobProgress progress);
}
