package com.aim.auth.repository;

import com.aim.auth.model.UsageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecord, String> {

    List<UsageRecord> findByTimestampGreaterThanEqual(Instant since);

    long countByUserIdAndTimestampGreaterThanEqual(String userId, Instant since);
}
