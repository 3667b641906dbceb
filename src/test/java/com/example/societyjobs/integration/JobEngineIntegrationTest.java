package com.example.societyjobs.integration;

import com.example.societyjobs.TestcontainersConfiguration;
import com.example.societyjobs.domain.entity.Event;
import com.example.societyjobs.domain.enums.EventAudience;
import com.example.societyjobs.domain.enums.EventStatus;
import com.example.societyjobs.domain.enums.Visibility;
import com.example.societyjobs.domain.repository.EventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "spring.main.web-application-type=servlet",
                "spring.jpa.hibernate.ddl-auto=create-drop",
                "job-engine.reminders.polling-interval-minutes=1440",
                "job-engine.triggers.publishing-cron=0 0 0 1 1 *",
                "job-engine.triggers.status-cron=0 0 0 1 1 *",
                "slack.enabled=false"
        }
)
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Job Engine Integration Tests")
class JobEngineIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EventRepository eventRepository;

    @BeforeEach
    void setUp() {
        eventRepository.deleteAll();
    }

    @Nested
    @DisplayName("Status API")
    class StatusApiTests {

        @Test
        @DisplayName("Should list every registered job")
        void shouldListJobs() throws Exception {
            mockMvc.perform(get("/api/v1/jobs/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.jobs", hasSize(5)))
                    .andExpect(jsonPath("$.data.jobs[?(@.name == 'stale-record-cleanup')]").exists())
                    .andExpect(jsonPath("$.data.jobs[?(@.name == 'event-reminders')]").exists());
        }

        @Test
        @DisplayName("Should return healthy status")
        void shouldReturnHealthy() throws Exception {
            mockMvc.perform(get("/api/v1/jobs/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data").value("OK"));
        }
    }

    @Nested
    @DisplayName("Manual run API")
    class ManualRunApiTests {

        @Test
        @DisplayName("Should move started and finished events on a manual status run")
        void shouldRunEventStatusUpdate() throws Exception {
            // Given
            var now = Instant.now();
            var started = saveEvent("Started", now.minus(Duration.ofHours(1)), now.plus(Duration.ofHours(1)));
            var finished = saveEvent("Finished", now.minus(Duration.ofHours(3)), now.minus(Duration.ofHours(1)));
            var future = saveEvent("Future", now.plus(Duration.ofDays(2)), now.plus(Duration.ofDays(2).plusHours(2)));

            // When
            mockMvc.perform(post("/api/v1/jobs/{jobName}/run", "event-status-update"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.outcome").value("COMPLETED"))
                    .andExpect(jsonPath("$.data.details.ongoing").value(1))
                    .andExpect(jsonPath("$.data.details.completed").value(1));

            // Then
            assertThat(eventRepository.findById(started.getId()).orElseThrow().getStatus()).isEqualTo(EventStatus.ONGOING);
            assertThat(eventRepository.findById(finished.getId()).orElseThrow().getStatus()).isEqualTo(EventStatus.COMPLETED);
            assertThat(eventRepository.findById(future.getId()).orElseThrow().getStatus()).isEqualTo(EventStatus.UPCOMING);
        }

        @Test
        @DisplayName("Should publish a due invite-only event without notifying anyone")
        void shouldRunScheduledPublishing() throws Exception {
            // Given
            var event = eventRepository.save(Event.builder()
                    .societyId(UUID.randomUUID())
                    .title("Closed workshop")
                    .visibility(Visibility.SCHEDULE)
                    .audience(EventAudience.INVITE)
                    .publishAt(Instant.now().minusSeconds(60))
                    .startsAt(Instant.now().plus(Duration.ofDays(3)))
                    .endsAt(Instant.now().plus(Duration.ofDays(3).plusHours(2)))
                    .build());

            // When
            mockMvc.perform(post("/api/v1/jobs/{jobName}/run", "scheduled-publishing"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.details.eventsPublished").value(1));

            // Then
            assertThat(eventRepository.findById(event.getId()).orElseThrow().getVisibility()).isEqualTo(Visibility.PUBLISH);
        }

        @Test
        @DisplayName("Should return 404 for an unknown job")
        void shouldReturn404ForUnknownJob() throws Exception {
            mockMvc.perform(post("/api/v1/jobs/{jobName}/run", "no-such-job"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false));
        }
    }

    private Event saveEvent(String title, Instant startsAt, Instant endsAt) {
        return eventRepository.save(Event.builder()
                .societyId(UUID.randomUUID())
                .title(title)
                .visibility(Visibility.PUBLISH)
                .status(EventStatus.UPCOMING)
                .startsAt(startsAt)
                .endsAt(endsAt)
                .build());
    }
}
