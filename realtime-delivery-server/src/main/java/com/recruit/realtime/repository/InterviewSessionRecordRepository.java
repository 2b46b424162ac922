package com.recruit.realtime.repository;

import com.recruit.realtime.domain.InterviewSessionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface InterviewSessionRecordRepository extends JpaRepository<InterviewSessionRecord, Long> {

    /**
     * Sessions of a user newer than the watermark, restricted to the given statuses
     */
    List<InterviewSessionRecord> findTop100ByUserIdAndIdGreaterThanAndStatusInOrderByIdAsc(
            String userId, Long watermark, Collection<String> statuses);

    Optional<InterviewSessionRecord> findFirstByUserIdOrderByIdDesc(String userId);
}
