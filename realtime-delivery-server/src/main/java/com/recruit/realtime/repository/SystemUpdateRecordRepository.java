package com.recruit.realtime.repository;

import com.recruit.realtime.domain.SystemUpdateRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SystemUpdateRecordRepository extends JpaRepository<SystemUpdateRecord, Long> {

    List<SystemUpdateRecord> findTop100ByUserIdAndIdGreaterThanOrderByIdAsc(String userId, Long watermark);

    Optional<SystemUpdateRecord> findFirstByUserIdOrderByIdDesc(String userId);
}
