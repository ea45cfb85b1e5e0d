package com.example.catalog_import.controller;

import com.example.catalog_import.dto.web.JobStatusResponse;
import com.example.catalog_import.service.job.ImportJobService;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/v1/import/job")
public class ImportJobController {
    private final ImportJobService jobService;

    public ImportJobController(ImportJobService jobService) {
        this.jobService = jobService;
    }

    /** Polling never fails on an unknown id; it answers {@code not_found} instead. */
    @Operation(summary = "Poll a background import job")
    @GetMapping("/{id}")
    public JobStatusResponse get(@PathVariable String id) {
        return jobService.find(id).map(JobStatusResponse::of).orElseGet(JobStatusResponse::notFound);
    }

    /** Only queued jobs are cancelled; the answer shows the job as it stands afterwards. */
    @Operation(summary = "Cancel a job that has not started yet")
    @PostMapping("/{id}/cancel")
    public JobStatusResponse cancel(@PathVariable String id) {
        return jobService.cancel(id)
                .map(JobStatusResponse::of)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }
}
