package com.recruit.realtime.repository;

import com.recruit.realtime.domain.ApplicationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ApplicationRecordRepository extends JpaRepository<ApplicationRecord, Long> {

    List<ApplicationRecord> findTop100ByUserIdAndIdGreaterThanOrderByIdAsc(String userId, Long watermark);

    Optional<ApplicationRecord> findFirstByUserIdOrderByIdDesc(String userId);
}
