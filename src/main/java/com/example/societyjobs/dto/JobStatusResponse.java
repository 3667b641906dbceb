package com.example.societyjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of every registered job plus engine-wide figures
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {

    private List<JobDescriptorResponse> jobs;
    private int reminderCacheSize;
    private long uptimeMs;
    private Instant generatedAt;
}
