package com.example.societyjobs.service.handler;

import com.example.societyjobs.config.JobEngineProperties;
import com.example.societyjobs.domain.entity.JoinRequest;
import com.example.societyjobs.domain.enums.JobType;
import com.example.societyjobs.domain.repository.JoinRequestRepository;
import com.example.societyjobs.domain.repository.MeetingRepository;
import com.example.societyjobs.domain.repository.PushTokenRepository;
import com.example.societyjobs.service.storage.BlobCleanupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Handler for the stale-record-cleanup job.
 * <p>
 * Purges processed join requests older than the retention period in batches, then the
 * PDF blobs those requests referenced, then finished meetings and dead push tokens.
 * <p>
 * Deleted rows drop out of the next fetch, so the batch offset only moves past batches
 * whose delete failed. Every batch and blob failure is recorded and the loop goes on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CleanupJobHandler implements JobHandler {

    private final JoinRequestRepository joinRequestRepository;
    private final MeetingRepository meetingRepository;
    private final PushTokenRepository pushTokenRepository;
    private final BlobCleanupService blobCleanupService;
    private final JobEngineProperties properties;
    private final Clock clock;

    @Override
    public JobType getJobType() {
        return JobType.STALE_RECORD_CLEANUP;
    }

    @Override
    public JobExecutionResult execute() {
        var settings = properties.getCleanup();
        var now = clock.instant();
        var cutoff = now.minus(Duration.ofDays(settings.getRetentionDays()));
        var result = JobExecutionResult.success();

        log.info("Cleaning up join requests processed before {}", cutoff);
        cleanupJoinRequests(cutoff, settings.getBatchSize(), result);
        cleanupMeetings(cutoff, result);
        cleanupPushTokens(now.minus(Duration.ofDays(settings.getPushTokenRetentionDays())), result);

        return result;
    }

    private void cleanupJoinRequests(Instant cutoff, int batchSize, JobExecutionResult result) {
        var offset = 0;
        var batches = 0;
        var deletedRequests = 0;
        var blobsDeleted = 0;
        var blobsFailed = 0;

        while (true) {
            var batch = joinRequestRepository.findStaleBatch(cutoff, batchSize, offset);
            if (batch.isEmpty()) {
                break;
            }
            batches++;
            result.addProcessed(batch.size());

            var ids = batch.stream().map(JoinRequest::getId).toList();
            int deleted;
            try {
                deleted = joinRequestRepository.deleteByIdIn(ids);
            } catch (Exception e) {
                log.error("Failed to delete join request batch at offset {} ({} rows): {}", offset, batch.size(), e.getMessage());
                result.addError("join-request batch at offset " + offset + ": " + e.getMessage());
                offset += batch.size();
                continue;
            }
            deletedRequests += deleted;
            result.addSuccessful(deleted);

            var pdfUrls = batch.stream()
                    .map(JoinRequest::getPdfUrl)
                    .filter(Objects::nonNull)
                    .filter(url -> !url.isBlank())
                    .toList();
            var blobs = blobCleanupService.deleteAll(pdfUrls);
            blobsDeleted += blobs.getDeleted();
            blobsFailed += blobs.getFailed();
            result.addErrors(blobs.getErrors());

            log.debug("Join request batch {}: {} rows deleted, {} of {} blobs deleted",
                    batches, deleted, blobs.getDeleted(), blobs.getAttempted());
        }

        log.info("Join request cleanup finished: {} batches, {} requests deleted, {} blobs deleted, {} blobs failed",
                batches, deletedRequests, blobsDeleted, blobsFailed);
        result.withDetail("batches", batches)
                .withDetail("joinRequestsDeleted", deletedRequests)
                .withDetail("blobsDeleted", blobsDeleted)
                .withDetail("blobsFailed", blobsFailed);
    }

    private void cleanupMeetings(Instant cutoff, JobExecutionResult result) {
        try {
            var deleted = meetingRepository.deleteFinishedBefore(cutoff);
            log.info("Deleted {} finished meetings created before {}", deleted, cutoff);
            result.withDetail("meetingsDeleted", deleted);
        } catch (Exception e) {
            log.error("Failed to delete finished meetings: {}", e.getMessage());
            result.addError("meetings: " + e.getMessage());
        }
    }

    private void cleanupPushTokens(Instant cutoff, JobExecutionResult result) {
        try {
            var deleted = pushTokenRepository.deleteInactiveOrUnusedSince(cutoff);
            log.info("Deleted {} inactive or unused push tokens", deleted);
            result.withDetail("pushTokensDeleted", deleted);
        } catch (Exception e) {
            log.error("Failed to delete push tokens: {}", e.getMessage());
            result.addError("push-tokens: " + e.getMessage());
        }
    }
}
