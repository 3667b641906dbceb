package com.example.societyjobs.service.executor;

import com.example.societyjobs.service.handler.JobExecutionResult;

/**
 * The unit of work run by {@link JobExecutorService}. Throwing marks the run as failed.
 */
@FunctionalInterface
public interface JobBody {

    JobExecutionResult run() throws Exception;
}
