package com.example.societyjobs.service.handler;

import com.example.societyjobs.domain.enums.JobType;

/**
 * Interface for job bodies.
 * <p>
 * Each job type has one handler that knows how to perform a single pass of that job.
 * <p>
 * Handlers should:
 * - Be stateless between runs
 * - Contain item-level failures in the returned result
 * - Throw only when the whole pass cannot proceed (the executor then retries)
 * - Never touch the run guard (handled by the executor)
 */
public interface JobHandler {

    /**
     * Get the job this handler implements
     */
    JobType getJobType();

    /**
     * Perform one pass of the job
     *
     * @return Counters and item-level errors for the pass
     */
    JobExecutionResult execute();

    /**
     * Name used for registration and lookup
     */
    default String getJobName() {
        return getJobType().getCode();
    }
}
