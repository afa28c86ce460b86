package com.example.portalsync.repository.jpa;

import com.example.portalsync.domain.entity.ScheduleRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ScheduleRecordRepository extends JpaRepository<ScheduleRecord, UUID> {

  Optional<ScheduleRecord> findByIdentityExternalIdAndSemesterScope(String externalId, String semesterScope);

  long countByIdentityExternalId(String externalId);
}
