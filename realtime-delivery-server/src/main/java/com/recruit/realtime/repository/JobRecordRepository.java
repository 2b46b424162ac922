package com.recruit.realtime.repository;

import com.recruit.realtime.domain.JobRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JobRecordRepository extends JpaRepository<JobRecord, Long> {

    List<JobRecord> findTop100ByUserIdAndIdGreaterThanAndStatusOrderByIdAsc(
            String userId, Long watermark, String status);

    Optional<JobRecord> findFirstByUserIdOrderByIdDesc(String userId);
}
