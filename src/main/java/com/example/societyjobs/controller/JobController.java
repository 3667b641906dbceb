package com.example.societyjobs.controller;

import com.example.societyjobs.dto.ApiResponse;
import com.example.societyjobs.dto.JobRunResponse;
import com.example.societyjobs.dto.JobStatusResponse;
import com.example.societyjobs.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API controller for job monitoring and manual runs.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Operations", description = "APIs for monitoring and triggering background jobs")
public class JobController {

    private final JobManagementService jobManagementService;

    @GetMapping("/status")
    @Operation(summary = "Get job statuses", description = "Running flag, last successful run and failure count of every job")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getStatus() {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJobStatuses()));
    }

    @PostMapping("/{jobName}/run")
    @Operation(summary = "Run a job now", description = "Run a job immediately; skipped if it is already running")
    public ResponseEntity<ApiResponse<JobRunResponse>> runJob(
            @Parameter(description = "Job name, e.g. stale-record-cleanup") @PathVariable String jobName) {
        log.info("API: Manual run of job {}", jobName);

        var response = jobManagementService.executeJobManually(jobName);
        var message = switch (response.getOutcome()) {
            case COMPLETED -> "Job completed";
            case SKIPPED -> "Job is already running, run skipped";
            case FAILED -> "Job failed";
        };
        return ResponseEntity.ok(ApiResponse.success(response, message));
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the job engine is running")
    public ResponseEntity<ApiResponse<String>> healthCheck() {
        return ResponseEntity.ok(ApiResponse.success("OK", "Job engine is running"));
    }
}
