package com.example.societyjobs.dto;

import com.example.societyjobs.domain.enums.JobRunOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a manually triggered run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunResponse {

    private String jobName;
    private JobRunOutcome outcome;
    private int totalProcessed;
    private int successful;
    private List<String> errors;
    private long durationMs;
    private Map<String, Object> details;
    private String errorMessage;
}
