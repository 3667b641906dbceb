package com.example.societyjobs.service.handler;

import com.example.societyjobs.domain.enums.JobType;
import com.example.societyjobs.exception.JobNotRegisteredException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobHandlerRegistry Tests")
class JobHandlerRegistryTest {

    private JobHandlerRegistry registry;

    private final JobHandler sweepHandler = handlerFor(JobType.REMINDER_CACHE_SWEEP);
    private final JobHandler statusHandler = handlerFor(JobType.EVENT_STATUS_UPDATE);

    private static JobHandler handlerFor(JobType type) {
        return new JobHandler() {
            @Override
            public JobType getJobType() {
                return type;
            }

            @Override
            public JobExecutionResult execute() {
                return JobExecutionResult.success();
            }
        };
    }

    @BeforeEach
    void setUp() {
        registry = new JobHandlerRegistry(List.of(sweepHandler, statusHandler));
        registry.initialize();
    }

    @Test
    @DisplayName("Should register handlers under their job name")
    void shouldRegisterHandlersUnderJobName() {
        assertThat(registry.getHandler("reminder-cache-sweep")).containsSame(sweepHandler);
        assertThat(registry.getHandler("event-status-update")).containsSame(statusHandler);
    }

    @Test
    @DisplayName("Should return empty for a job without handler")
    void shouldReturnEmptyForJobWithoutHandler() {
        assertThat(registry.getHandler("event-reminders")).isEmpty();
        assertThat(registry.hasHandler("event-reminders")).isFalse();
    }

    @Test
    @DisplayName("Should throw for unknown job when using getHandlerOrThrow")
    void shouldThrowForUnknownJob() {
        assertThatThrownBy(() -> registry.getHandlerOrThrow("unknown-job"))
                .isInstanceOf(JobNotRegisteredException.class)
                .hasMessage("Job not registered: unknown-job");
    }

    @Test
    @DisplayName("Should keep registration order")
    void shouldKeepRegistrationOrder() {
        assertThat(registry.getHandlerCount()).isEqualTo(2);
        assertThat(registry.getHandlers()).containsExactly(sweepHandler, statusHandler);
    }
}
