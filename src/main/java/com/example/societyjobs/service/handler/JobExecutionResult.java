package com.example.societyjobs.service.handler;

import com.example.societyjobs.domain.enums.JobRunOutcome;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents the result of one job run.
 * <p>
 * Job bodies accumulate counters and item-level errors into it while they run;
 * the executor stamps the job name, outcome and duration. Never persisted.
 */
@Data
@Builder
public class JobExecutionResult {

    /**
     * Name of the job that produced this result
     */
    private String jobName;

    /**
     * How the run ended
     */
    @Builder.Default
    private JobRunOutcome outcome = JobRunOutcome.COMPLETED;

    /**
     * Items the run looked at
     */
    private int totalProcessed;

    /**
     * Items handled without error
     */
    private int successful;

    /**
     * Item-level errors; a non-empty list does not make the run a failure
     */
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    /**
     * Wall-clock duration of the body
     */
    private long durationMs;

    /**
     * Job-specific figures (e.g. rows moved to each status)
     */
    @Builder.Default
    private Map<String, Object> details = new HashMap<>();

    /**
     * Error message when the body itself failed
     */
    private String errorMessage;

    /**
     * Error type/classification when the body itself failed
     */
    private String errorType;

    /**
     * Create an empty completed result for a body to fill in
     */
    public static JobExecutionResult success() {
        return JobExecutionResult.builder().build();
    }

    /**
     * Result for a run rejected by the run guard
     */
    public static JobExecutionResult skipped(String jobName) {
        return JobExecutionResult.builder()
                .jobName(jobName)
                .outcome(JobRunOutcome.SKIPPED)
                .build();
    }

    /**
     * Result for a body that threw
     */
    public static JobExecutionResult failure(String jobName, Exception e) {
        return JobExecutionResult.builder()
                .jobName(jobName)
                .outcome(JobRunOutcome.FAILED)
                .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getName())
                .errorType(e.getClass().getSimpleName())
                .build();
    }

    public boolean isSkipped() {
        return outcome == JobRunOutcome.SKIPPED;
    }

    public boolean isFailed() {
        return outcome == JobRunOutcome.FAILED;
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    public JobExecutionResult addProcessed(int count) {
        this.totalProcessed += count;
        return this;
    }

    public JobExecutionResult addSuccessful(int count) {
        this.successful += count;
        return this;
    }

    /**
     * Record a failure scoped to a single item
     */
    public JobExecutionResult addError(String error) {
        if (this.errors == null) {
            this.errors = new ArrayList<>();
        }
        this.errors.add(error);
        return this;
    }

    public JobExecutionResult addErrors(List<String> errors) {
        errors.forEach(this::addError);
        return this;
    }

    /**
     * Add or update a details entry
     */
    public JobExecutionResult withDetail(String key, Object value) {
        if (this.details == null) {
            this.details = new HashMap<>();
        }
        this.details.put(key, value);
        return this;
    }
}
