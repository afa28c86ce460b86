package com.example.portalsync.repository.jpa;

import com.example.portalsync.domain.entity.AcademicIdentity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AcademicIdentityRepository extends JpaRepository<AcademicIdentity, String> {

  /**
   * Bulk delete so the database-level cascade removes dependents.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("delete from AcademicIdentity i where i.externalId = :externalId")
  int deleteByExternalId(@Param("externalId") String externalId);
}
