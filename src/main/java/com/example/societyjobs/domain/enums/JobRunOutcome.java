package com.example.societyjobs.domain.enums;

/**
 * How a single invocation of a job ended.
 */
public enum JobRunOutcome {

    /**
     * Body returned normally. Item-level errors may still be present in the result.
     */
    COMPLETED,

    /**
     * Body threw; counted against the job's consecutive failures.
     */
    FAILED,

    /**
     * A previous run of the same job was still active, so the body was not invoked.
     */
    SKIPPED
}
