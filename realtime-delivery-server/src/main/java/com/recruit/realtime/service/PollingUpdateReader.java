package com.recruit.realtime.service;

import com.recruit.realtime.domain.ApplicationRecord;
import com.recruit.realtime.domain.DeliveryEvent;
import com.recruit.realtime.domain.EventTarget;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads records newer than a watermark from the system of record and shapes
 * them as the events the live path would have produced.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PollingUpdateReader {

    static final String STATUS_READY = "ready";
    static final String STATUS_IN_PROGRESS = "in_progress";
    static final String STATUS_COMPLETED = "completed";

    private static final Set<String> INTERVIEW_STATUSES = Set.of(STATUS_READY, STATUS_IN_PROGRESS, STATUS_COMPLETED);

    private final InterviewSessionRecordRepository interviewRepository;
    private final ApplicationRecordRepository applicationRepository;
    private final JobRecordRepository jobRepository;
    private final SystemUpdateRecordRepository systemUpdateRepository;

    /**
     * Records with id greater than {@code watermark}, ascending, at most 100.
     * A null watermark reads from the beginning.
     */
    @Transactional(readOnly = true)
    public List<PollUpdate> fetchUpdates(String userId, PollType type, Long watermark) {
        long after = watermark != null ? watermark : 0L;
        return switch (type) {
            case INTERVIEW -> interviewRepository
                    .findTop100ByUserIdAndIdGreaterThanAndStatusInOrderByIdAsc(userId, after, INTERVIEW_STATUSES)
                    .stream().map(this::interviewUpdate).collect(Collectors.toList());
            case APPLICATION -> applicationRepository
                    .findTop100ByUserIdAndIdGreaterThanOrderByIdAsc(userId, after)
                    .stream().map(this::applicationUpdate).collect(Collectors.toList());
            case JOB -> jobRepository
                    .findTop100ByUserIdAndIdGreaterThanAndStatusOrderByIdAsc(userId, after, JobRecord.STATUS_ACTIVE)
                    .stream().map(this::jobUpdate).collect(Collectors.toList());
            case SYSTEM -> systemUpdateRepository
                    .findTop100ByUserIdAndIdGreaterThanOrderByIdAsc(userId, after)
                    .stream().map(this::systemUpdate).collect(Collectors.toList());
        };
    }

    /**
     * Id of the user's newest record of the given type, if any. Used as the
     * starting watermark when nothing has been delivered before.
     */
    @Transactional(readOnly = true)
    public Optional<Long> latestRecordId(String userId, PollType type) {
        return switch (type) {
            case INTERVIEW -> interviewRepository.findFirstByUserIdOrderByIdDesc(userId).map(InterviewSessionRecord::getId);
            case APPLICATION -> applicationRepository.findFirstByUserIdOrderByIdDesc(userId).map(ApplicationRecord::getId);
            case JOB -> jobRepository.findFirstByUserIdOrderByIdDesc(userId).map(JobRecord::getId);
            case SYSTEM -> systemUpdateRepository.findFirstByUserIdOrderByIdDesc(userId).map(SystemUpdateRecord::getId);
        };
    }

    private PollUpdate interviewUpdate(InterviewSessionRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", record.getSessionId());
        payload.put("status", record.getStatus());
        payload.put("questions", record.getQuestions());
        payload.put("scores", record.getScores());
        return update(record.getId(), interviewEventType(record.getStatus()), record.getUserId(),
                record.getJobId(), payload, record.getUpdatedAt());
    }

    private PollUpdate applicationUpdate(ApplicationRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("application_id", record.getId());
        payload.put("status", record.getStatus());
        payload.put("score", record.getScore());
        payload.put("feedback", record.getFeedback());
        return update(record.getId(), EventType.APPLICATION_STATUS_CHANGED, record.getUserId(),
                record.getJobId(), payload, record.getUpdatedAt());
    }

    private PollUpdate jobUpdate(JobRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", record.getStatus());
        payload.put("title", record.getTitle());
        payload.put("applications", record.getApplicationCount());
        return update(record.getId(), EventType.JOB_UPDATED, record.getUserId(),
                String.valueOf(record.getId()), payload, record.getUpdatedAt());
    }

    private PollUpdate systemUpdate(SystemUpdateRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("severity", record.getSeverity() != null ? record.getSeverity() : "info");
        payload.put("title", record.getTitle());
        payload.put("content", record.getContent());
        payload.put("action_required", record.isActionRequired());
        return update(record.getId(), EventType.SYSTEM_ANNOUNCEMENT, record.getUserId(),
                null, payload, record.getCreatedAt());
    }

    static EventType interviewEventType(String status) {
        if (STATUS_READY.equals(status)) {
            return EventType.INTERVIEW_QUESTIONS_READY;
        }
        if (STATUS_IN_PROGRESS.equals(status)) {
            return EventType.INTERVIEW_STARTED;
        }
        return EventType.INTERVIEW_COMPLETED;
    }

    private static PollUpdate update(Long id, EventType type, String userId, String jobId,
                                     Map<String, Object> payload, Instant at) {
        DeliveryEvent event = DeliveryEvent.builder()
                .eventType(type)
                .target(EventTarget.user(userId))
                .jobId(jobId)
                .payload(payload)
                .createdAt(at != null ? at : Instant.now())
                .build();
        return new PollUpdate(id, event);
    }
}
