package com.example.societyjobs.exception;

import lombok.Getter;

/**
 * Exception for executing a job name that was never registered.
 * A configuration error: it is never retried.
 */
@Getter
public class JobNotRegisteredException extends RuntimeException {

    private final String jobName;

    public JobNotRegisteredException(String jobName) {
        super("Job not registered: " + jobName);
        this.jobName = jobName;
    }
}
