package com.example.portalsync.repository.jpa;

import com.example.portalsync.domain.entity.AcademicSnapshot;
import com.example.portalsync.domain.model.ResourceKind;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AcademicSnapshotRepository extends JpaRepository<AcademicSnapshot, UUID> {

  Optional<AcademicSnapshot> findFirstByIdentityExternalIdAndKindAndScopeOrderByFetchedAtDesc(
      String externalId, ResourceKind kind, String scope);

  List<AcademicSnapshot> findByIdentityExternalIdAndKindAndScopeOrderByFetchedAtDesc(
      String externalId, ResourceKind kind, String scope, Pageable pageable);

  List<AcademicSnapshot> findByIdentityExternalIdAndKindOrderByFetchedAtDesc(
      String externalId, ResourceKind kind, Pageable pageable);

  List<AcademicSnapshot> findByIdentityExternalIdOrderByFetchedAtDesc(String externalId, Pageable pageable);

  long countByIdentityExternalId(String externalId);

  @Query("select distinct s.kind as kind, s.scope as scope from AcademicSnapshot s "
      + "where s.identity.externalId = :externalId")
  List<KindScope> findKindScopes(@Param("externalId") String externalId);

  interface KindScope {
    ResourceKind getKind();

    String getScope();
  }
}
