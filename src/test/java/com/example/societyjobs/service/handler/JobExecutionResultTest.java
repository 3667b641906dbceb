package com.example.societyjobs.service.handler;

import com.example.societyjobs.domain.enums.JobRunOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobExecutionResult Tests")
class JobExecutionResultTest {

    @Test
    @DisplayName("Should start as an empty completed result")
    void shouldStartEmpty() {
        var result = JobExecutionResult.success();

        assertThat(result.getOutcome()).isEqualTo(JobRunOutcome.COMPLETED);
        assertThat(result.getTotalProcessed()).isZero();
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.getDetails()).isEmpty();
    }

    @Test
    @DisplayName("Should accumulate counters and errors")
    void shouldAccumulateCountersAndErrors() {
        var result = JobExecutionResult.success()
                .addProcessed(3)
                .addProcessed(2)
                .addSuccessful(4)
                .addError("event 1: boom")
                .addErrors(List.of("blob a: not deleted"))
                .withDetail("ongoing", 2);

        assertThat(result.getTotalProcessed()).isEqualTo(5);
        assertThat(result.getSuccessful()).isEqualTo(4);
        assertThat(result.getErrors()).containsExactly("event 1: boom", "blob a: not deleted");
        assertThat(result.getDetails()).containsEntry("ongoing", 2);
        assertThat(result.isFailed()).isFalse();
    }

    @Test
    @DisplayName("Should create failure result from exception")
    void shouldCreateFailureFromException() {
        var result = JobExecutionResult.failure("stale-record-cleanup", new IllegalStateException("db down"));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getJobName()).isEqualTo("stale-record-cleanup");
        assertThat(result.getErrorMessage()).isEqualTo("db down");
        assertThat(result.getErrorType()).isEqualTo("IllegalStateException");
    }

    @Test
    @DisplayName("Should fall back to exception class when message is missing")
    void shouldFallBackToClassName() {
        var result = JobExecutionResult.failure("event-reminders", new IllegalStateException());

        assertThat(result.getErrorMessage()).isEqualTo("java.lang.IllegalStateException");
    }

    @Test
    @DisplayName("Should create skipped result")
    void shouldCreateSkippedResult() {
        var result = JobExecutionResult.skipped("event-reminders");

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getOutcome()).isEqualTo(JobRunOutcome.SKIPPED);
    }
}
