package com.recruit.realtime.service;

import com.recruit.realtime.domain.ApplicationRecord;
import com.recruit.realtime.domain.DeliveryEvent;
import com.recruit.realtime.domain.EventType;
import com.recruit.realtime.domain.InterviewSessionRecord;
import com.recruit.realtime.domain.JobRecord;
import com.recruit.realtime.domain.PollType;
import com.recruit.realtime.domain.PollUpdate;
import com.recruit.realtime.domain.SystemUpdateRecord;
import com.recruit.realtime.repository.ApplicationRecordRepository;
import com.recruit.realtime.repository.InterviewSessionRecordRepository;
import com.recruit.realtime.repository.JobRecordRepository;
import com.recruit.realtime.repository.SystemUpdateRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PollingUpdateReaderTest {

    @Mock
    private InterviewSessionRecordRepository interviewRepository;

    @Mock
    private ApplicationRecordRepository applicationRepository;

    @Mock
    private JobRecordRepository jobRepository;

    @Mock
    private SystemUpdateRecordRepository systemUpdateRepository;

    private PollingUpdateReader reader;

    @BeforeEach
    void setUp() {
        reader = new PollingUpdateReader(interviewRepository, applicationRepository, jobRepository, systemUpdateRepository);
    }

    @Test
    @DisplayName("Interview records map their status onto the interview event types")
    @SuppressWarnings("unchecked")
    void interviewStatusMapping() {
        when(interviewRepository.findTop100ByUserIdAndIdGreaterThanAndStatusInOrderByIdAsc(eq("u1"), eq(10L), any()))
                .thenReturn(List.of(interview(11L, "ready"), interview(12L, "in_progress"), interview(13L, "completed")));

        List<PollUpdate> updates = reader.fetchUpdates("u1", PollType.INTERVIEW, 10L);

        assertThat(updates).extracting(PollUpdate::getRecordId).containsExactly(11L, 12L, 13L);
        assertThat(updates).extracting(update -> update.getEvent().getEventType()).containsExactly(
                EventType.INTERVIEW_QUESTIONS_READY, EventType.INTERVIEW_STARTED, EventType.INTERVIEW_COMPLETED);

        ArgumentCaptor<Collection<String>> statuses = ArgumentCaptor.forClass(Collection.class);
        verify(interviewRepository).findTop100ByUserIdAndIdGreaterThanAndStatusInOrderByIdAsc(eq("u1"), eq(10L), statuses.capture());
        assertThat(statuses.getValue()).containsExactlyInAnyOrder("ready", "in_progress", "completed");
    }

    @Test
    @DisplayName("A missing watermark reads from the beginning")
    void nullWatermarkReadsFromStart() {
        when(applicationRepository.findTop100ByUserIdAndIdGreaterThanOrderByIdAsc("u1", 0L)).thenReturn(List.of(
                ApplicationRecord.builder().id(1L).userId("u1").jobId("job-3").status("shortlisted").score(87.5).build()));

        List<PollUpdate> updates = reader.fetchUpdates("u1", PollType.APPLICATION, null);

        DeliveryEvent event = updates.get(0).getEvent();
        assertThat(event.getEventType()).isEqualTo(EventType.APPLICATION_STATUS_CHANGED);
        assertThat(event.getTarget().getUserId()).isEqualTo("u1");
        assertThat(event.getJobId()).isEqualTo("job-3");
        assertThat(event.status()).isEqualTo("shortlisted");
        assertThat(event.getPayload()).containsEntry("score", 87.5).containsEntry("application_id", 1L);
    }

    @Test
    void jobPollingOnlyReadsActiveJobs() {
        when(jobRepository.findTop100ByUserIdAndIdGreaterThanAndStatusOrderByIdAsc("u1", 4L, "active")).thenReturn(List.of(
                JobRecord.builder().id(5L).userId("u1").title("Backend Engineer").status("active").applicationCount(12).build()));

        List<PollUpdate> updates = reader.fetchUpdates("u1", PollType.JOB, 4L);

        DeliveryEvent event = updates.get(0).getEvent();
        assertThat(event.getEventType()).isEqualTo(EventType.JOB_UPDATED);
        assertThat(event.getJobId()).isEqualTo("5");
        assertThat(event.getPayload()).containsEntry("applications", 12).containsEntry("title", "Backend Engineer");
    }

    @Test
    void systemUpdatesDefaultToInfoSeverity() {
        Instant createdAt = Instant.parse("2024-05-01T08:00:00Z");
        when(systemUpdateRepository.findTop100ByUserIdAndIdGreaterThanOrderByIdAsc("u1", 0L)).thenReturn(List.of(
                SystemUpdateRecord.builder().id(9L).userId("u1").title("Maintenance").content("Tonight")
                        .actionRequired(true).createdAt(createdAt).build()));

        DeliveryEvent event = reader.fetchUpdates("u1", PollType.SYSTEM, 0L).get(0).getEvent();

        assertThat(event.getEventType()).isEqualTo(EventType.SYSTEM_ANNOUNCEMENT);
        assertThat(event.getCreatedAt()).isEqualTo(createdAt);
        assertThat(event.getPayload())
                .containsEntry("severity", "info")
                .containsEntry("action_required", true);
    }

    @Test
    void latestRecordIdComesFromNewestRecord() {
        when(jobRepository.findFirstByUserIdOrderByIdDesc("u1"))
                .thenReturn(Optional.of(JobRecord.builder().id(30L).build()));

        assertThat(reader.latestRecordId("u1", PollType.JOB)).contains(30L);
        assertThat(reader.latestRecordId("u1", PollType.SYSTEM)).isEmpty();
    }

    private static InterviewSessionRecord interview(Long id, String status) {
        return InterviewSessionRecord.builder()
                .id(id)
                .sessionId("s-" + id)
                .userId("u1")
                .jobId("job-1")
                .status(status)
                .build();
    }
}
