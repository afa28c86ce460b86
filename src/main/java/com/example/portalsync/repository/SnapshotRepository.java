package com.example.portalsync.repository;

import com.example.portalsync.domain.entity.AcademicIdentity;
import com.example.portalsync.domain.entity.AcademicSnapshot;
import com.example.portalsync.domain.entity.CourseEntry;
import com.example.portalsync.domain.entity.GradeRecord;
import com.example.portalsync.domain.entity.ScheduleRecord;
import com.example.portalsync.domain.model.CourseView;
import com.example.portalsync.domain.model.GradeSheet;
import com.example.portalsync.domain.model.ProfileView;
import com.example.portalsync.domain.model.ResourceKind;
import com.example.portalsync.domain.model.ScheduleView;
import com.example.portalsync.domain.model.SemesterList;
import com.example.portalsync.domain.model.SnapshotView;
import com.example.portalsync.domain.model.StoredSnapshot;
import com.example.portalsync.properties.ApplicationProperties;
import com.example.portalsync.repository.jpa.AcademicIdentityRepository;
import com.example.portalsync.repository.jpa.AcademicSnapshotRepository;
import com.example.portalsync.repository.jpa.CourseEntryRepository;
import com.example.portalsync.repository.jpa.GradeRecordRepository;
import com.example.portalsync.repository.jpa.ScheduleRecordRepository;
import com.example.portalsync.service.cache.HotCache;
import com.example.portalsync.util.ContentHasher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable tier: append-only snapshot history, normalized current-state tables and the hot cache
 * refresh that follows every committed write.
 *
 * Each save runs in exactly one transaction. The hot cache is written after commit, so a cached
 * payload always has a durable counterpart.
 */
@Slf4j
@Repository
public class SnapshotRepository {

  public static final int MAX_HISTORY = 100;

  private final AcademicIdentityRepository identities;
  private final AcademicSnapshotRepository snapshots;
  private final GradeRecordRepository grades;
  private final ScheduleRecordRepository schedules;
  private final CourseEntryRepository courses;
  private final HotCache hotCache;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ApplicationProperties.CacheProperties cacheProperties;
  private final TransactionTemplate transactionTemplate;
  private final TransactionTemplate identityTransactionTemplate;

  public SnapshotRepository(
      AcademicIdentityRepository identities,
      AcademicSnapshotRepository snapshots,
      GradeRecordRepository grades,
      ScheduleRecordRepository schedules,
      CourseEntryRepository courses,
      HotCache hotCache,
      ObjectMapper objectMapper,
      Clock clock,
      ApplicationProperties properties,
      PlatformTransactionManager transactionManager) {
    this.identities = identities;
    this.snapshots = snapshots;
    this.grades = grades;
    this.schedules = schedules;
    this.courses = courses;
    this.hotCache = hotCache;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.cacheProperties = properties.cache();
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.identityTransactionTemplate = new TransactionTemplate(transactionManager);
    this.identityTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Return the identity for an external id, creating it when absent. A concurrent creator
   * winning the insert race is not an error.
   */
  public AcademicIdentity ensureIdentity(String externalId) {
    requireOwner(externalId);
    Optional<AcademicIdentity> existing = identities.findById(externalId);
    if (existing.isPresent()) {
      return existing.get();
    }
    try {
      return identityTransactionTemplate.execute(status ->
          identities.findById(externalId)
              .orElseGet(() -> identities.saveAndFlush(new AcademicIdentity(externalId, clock.instant()))));
    } catch (DataIntegrityViolationException e) {
      log.debug("Identity {} created concurrently", externalId);
      return identities.findById(externalId)
          .orElseThrow(() -> new IllegalStateException("Identity vanished after insert race: " + externalId, e));
    }
  }

  /**
   * Append a profile snapshot and overwrite only the identity fields the new fetch provides.
   */
  public void saveProfile(String owner, ProfileView profile) {
    Instant now = clock.instant();
    String payload = toJson(profile);
    transactionTemplate.executeWithoutResult(status -> {
      AcademicIdentity identity = ownerIdentity(owner);
      mergeProfile(identity, profile);
      identity.setUpdatedAt(now);
      identities.save(identity);
      appendSnapshot(identity, ResourceKind.PROFILE, "", payload, now);
      afterCommit(ResourceKind.PROFILE, owner, "", payload);
    });
  }

  public void saveSemesters(String owner, SemesterList semesters) {
    Instant now = clock.instant();
    String payload = toJson(semesters);
    transactionTemplate.executeWithoutResult(status -> {
      AcademicIdentity identity = ownerIdentity(owner);
      appendSnapshot(identity, ResourceKind.SEMESTERS, "", payload, now);
      afterCommit(ResourceKind.SEMESTERS, owner, "", payload);
    });
  }

  /**
   * Append a grade snapshot and upsert rows by content hash: an identical row is touched,
   * a changed row is inserted as a new record.
   */
  public void saveGrades(String owner, String scope, GradeSheet sheet) {
    Instant now = clock.instant();
    String normalizedScope = normalizeScope(scope);
    String payload = toJson(sheet);
    transactionTemplate.executeWithoutResult(status -> {
      AcademicIdentity identity = ownerIdentity(owner);
      appendSnapshot(identity, ResourceKind.GRADES, normalizedScope, payload, now);

      Set<String> seen = new HashSet<>();
      int inserted = 0;
      for (Map<String, String> row : sheet.rows()) {
        String hash = ContentHasher.hash(row);
        if (!seen.add(hash)) {
          continue;
        }
        String rawRow = ContentHasher.canonicalJson(row);
        Optional<GradeRecord> existing =
            grades.findByIdentityExternalIdAndSemesterScopeAndContentHash(owner, normalizedScope, hash);
        if (existing.isPresent()) {
          GradeRecord record = existing.get();
          record.setRawPayload(rawRow);
          record.setFetchedAt(now);
          grades.save(record);
        } else {
          grades.save(newGradeRecord(identity, normalizedScope, row, hash, rawRow, now));
          inserted++;
        }
      }
      log.debug("Grades for scope '{}': {} rows, {} new", normalizedScope, seen.size(), inserted);
      afterCommit(ResourceKind.GRADES, owner, normalizedScope, payload);
    });
  }

  /**
   * Append a schedule snapshot and replace the schedule's course entries with the new set.
   */
  public void saveSchedule(String owner, String scope, ScheduleView schedule) {
    Instant now = clock.instant();
    String normalizedScope = normalizeScope(scope);
    String payload = toJson(schedule);
    transactionTemplate.executeWithoutResult(status -> {
      AcademicIdentity identity = ownerIdentity(owner);
      appendSnapshot(identity, ResourceKind.SCHEDULE, normalizedScope, payload, now);

      ScheduleRecord record = schedules.findByIdentityExternalIdAndSemesterScope(owner, normalizedScope)
          .orElseGet(() -> {
            ScheduleRecord created = new ScheduleRecord();
            created.setIdentity(identity);
            created.setSemesterScope(normalizedScope);
            return created;
          });
      record.setCurrentWeek(schedule.currentWeek());
      record.setRawPayload(payload);
      record.setFetchedAt(now);
      record = schedules.saveAndFlush(record);

      int removed = courses.deleteByScheduleId(record.getId());
      List<CourseEntry> entries = new ArrayList<>();
      Set<String> seen = new HashSet<>();
      for (CourseView course : schedule.courses()) {
        if (!isStorable(course)) {
          continue;
        }
        String hash = ContentHasher.hash(course);
        if (seen.add(hash)) {
          entries.add(newCourseEntry(record, course, hash));
        }
      }
      courses.saveAll(entries);
      log.debug("Schedule '{}': replaced {} course entries with {}", normalizedScope, removed, entries.size());
      afterCommit(ResourceKind.SCHEDULE, owner, normalizedScope, payload);
    });
  }

  /**
   * Hot cache lookup. A corrupt cached value is evicted and reported as a miss.
   */
  public <T> Optional<T> readCached(ResourceKind kind, String owner, String scope, Class<T> type) {
    String key = kind.cacheKey(owner, scope);
    Optional<String> cached = hotCache.get(key);
    if (cached.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(cached.get(), type));
    } catch (JsonProcessingException e) {
      log.warn("Evicting unreadable hot cache entry {}: {}", key, e.getOriginalMessage());
      hotCache.evict(key);
      return Optional.empty();
    }
  }

  /**
   * Most recent durable snapshot for (kind, owner, scope).
   */
  public <T> Optional<StoredSnapshot<T>> latest(ResourceKind kind, String owner, String scope, Class<T> type) {
    return snapshots.findFirstByIdentityExternalIdAndKindAndScopeOrderByFetchedAtDesc(
            owner, kind, normalizeScope(scope))
        .flatMap(snapshot -> {
          try {
            return Optional.of(new StoredSnapshot<>(
                objectMapper.readValue(snapshot.getPayload(), type), snapshot.getFetchedAt()));
          } catch (JsonProcessingException e) {
            log.warn("Snapshot {} cannot be read as {}: {}", snapshot.getId(), type.getSimpleName(),
                e.getOriginalMessage());
            return Optional.empty();
          }
        });
  }

  /**
   * Most recent snapshots for an owner, newest first. Kind and scope narrow the query when given.
   */
  public List<SnapshotView> recent(String owner, ResourceKind kind, String scope, int limit) {
    Pageable page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_HISTORY)));
    List<AcademicSnapshot> rows;
    if (kind == null) {
      rows = snapshots.findByIdentityExternalIdOrderByFetchedAtDesc(owner, page);
    } else if (scope == null) {
      rows = snapshots.findByIdentityExternalIdAndKindOrderByFetchedAtDesc(owner, kind, page);
    } else {
      rows = snapshots.findByIdentityExternalIdAndKindAndScopeOrderByFetchedAtDesc(
          owner, kind, normalizeScope(scope), page);
    }
    return rows.stream().map(this::toView).toList();
  }

  /**
   * Remove an identity. The database cascades to snapshots, grades, schedules and courses.
   */
  public boolean deleteIdentity(String externalId) {
    List<AcademicSnapshotRepository.KindScope> cachedScopes = snapshots.findKindScopes(externalId);
    Integer deleted = transactionTemplate.execute(status -> identities.deleteByExternalId(externalId));
    for (AcademicSnapshotRepository.KindScope entry : cachedScopes) {
      hotCache.evict(entry.getKind().cacheKey(externalId, entry.getScope()));
    }
    log.info("Deleted identity {} ({} cache keys evicted)", externalId, cachedScopes.size());
    return deleted != null && deleted > 0;
  }

  private AcademicIdentity ownerIdentity(String owner) {
    ensureIdentity(owner);
    return identities.findById(owner)
        .orElseThrow(() -> new IllegalStateException("Identity missing after ensure: " + owner));
  }

  private void appendSnapshot(AcademicIdentity identity, ResourceKind kind, String scope, String payload,
                              Instant fetchedAt) {
    AcademicSnapshot snapshot = new AcademicSnapshot();
    snapshot.setIdentity(identity);
    snapshot.setKind(kind);
    snapshot.setScope(scope);
    snapshot.setPayload(payload);
    snapshot.setFetchedAt(fetchedAt);
    snapshots.save(snapshot);
  }

  private void afterCommit(ResourceKind kind, String owner, String scope, String payload) {
    Runnable write = () -> hotCache.put(kind.cacheKey(owner, scope), payload, ttlFor(kind));
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
        @Override
        public void afterCommit() {
          write.run();
        }
      });
    } else {
      write.run();
    }
  }

  Duration ttlFor(ResourceKind kind) {
    return switch (kind) {
      case PROFILE -> cacheProperties.profileTtl();
      case SEMESTERS -> cacheProperties.semestersTtl();
      case GRADES -> cacheProperties.gradesTtl();
      case SCHEDULE -> cacheProperties.scheduleTtl();
    };
  }

  private static void mergeProfile(AcademicIdentity identity, ProfileView profile) {
    if (profile.studentId() != null) {
      identity.setStudentId(profile.studentId());
    }
    if (profile.name() != null) {
      identity.setName(profile.name());
    }
    if (profile.college() != null) {
      identity.setCollege(profile.college());
    }
    if (profile.major() != null) {
      identity.setMajor(profile.major());
    }
    if (profile.className() != null) {
      identity.setClassName(profile.className());
    }
    if (profile.enrollmentYear() != null) {
      identity.setEnrollmentYear(profile.enrollmentYear());
    }
    if (profile.studyLevel() != null) {
      identity.setStudyLevel(profile.studyLevel());
    }
  }

  private static GradeRecord newGradeRecord(AcademicIdentity identity, String scope, Map<String, String> row,
                                            String hash, String rawRow, Instant now) {
    GradeRecord record = new GradeRecord();
    record.setIdentity(identity);
    record.setSemesterScope(scope);
    record.setCourseCode(GradeColumns.pick(row, GradeColumns.COURSE_CODE));
    record.setCourseName(GradeColumns.pick(row, GradeColumns.COURSE_NAME));
    record.setCredit(GradeColumns.pick(row, GradeColumns.CREDIT));
    record.setScore(GradeColumns.pick(row, GradeColumns.SCORE));
    record.setGradePoint(GradeColumns.pick(row, GradeColumns.GRADE_POINT));
    record.setContentHash(hash);
    record.setRawPayload(rawRow);
    record.setFetchedAt(now);
    return record;
  }

  private static boolean isStorable(CourseView course) {
    return course.name() != null && !course.name().isBlank()
        && course.weekday() > 0 && course.startSection() > 0 && course.endSection() > 0;
  }

  private static CourseEntry newCourseEntry(ScheduleRecord schedule, CourseView course, String hash) {
    CourseEntry entry = new CourseEntry();
    entry.setSchedule(schedule);
    entry.setName(course.name());
    entry.setTeacher(course.teacher());
    entry.setLocation(course.location());
    entry.setWeekday(course.weekday());
    entry.setStartSlot(course.startSection());
    entry.setEndSlot(course.endSection());
    entry.setWeekRangeLabel(course.weekRange());
    entry.setWeeks(course.weeks());
    entry.setContentHash(hash);
    return entry;
  }

  private SnapshotView toView(AcademicSnapshot snapshot) {
    JsonNode payload;
    try {
      payload = objectMapper.readTree(snapshot.getPayload());
    } catch (JsonProcessingException e) {
      payload = objectMapper.getNodeFactory().textNode(snapshot.getPayload());
    }
    return new SnapshotView(
        snapshot.getId(), snapshot.getKind().code(), snapshot.getScope(), snapshot.getFetchedAt(), payload);
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Payload cannot be serialized", e);
    }
  }

  private static String normalizeScope(String scope) {
    return scope == null ? "" : scope.trim();
  }

  private static void requireOwner(String externalId) {
    if (externalId == null || externalId.isBlank()) {
      throw new IllegalArgumentException("External id must not be blank");
    }
  }
}
