package com.example.portalsync.repository.jpa;

import com.example.portalsync.domain.entity.GradeRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GradeRecordRepository extends JpaRepository<GradeRecord, UUID> {

  Optional<GradeRecord> findByIdentityExternalIdAndSemesterScopeAndContentHash(
      String externalId, String semesterScope, String contentHash);

  List<GradeRecord> findByIdentityExternalIdAndSemesterScope(String externalId, String semesterScope);

  long countByIdentityExternalId(String externalId);
}
