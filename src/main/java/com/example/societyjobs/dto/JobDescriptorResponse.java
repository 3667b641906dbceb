package com.example.societyjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Monitoring view of a single registered job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDescriptorResponse {

    private String name;
    private boolean running;
    private Instant lastRun;
    private int consecutiveFailures;
}
