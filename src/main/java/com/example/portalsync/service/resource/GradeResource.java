package com.example.portalsync.service.resource;

import com.example.portalsync.adapter.portal.PortalRequest;
import com.example.portalsync.adapter.portal.PortalResponse;
import com.example.portalsync.adapter.portal.extract.GradeExtractor;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.GradeSheet;
import com.example.portalsync.domain.model.ResourceKind;
import com.example.portalsync.properties.ApplicationProperties;
import com.example.portalsync.repository.SnapshotRepository;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Grade list query. An empty scope asks for every semester.
 */
@Component
public class GradeResource implements PortalResource<GradeSheet> {

  static final String FIELD_SEMESTER = "kksj";
  static final String FIELD_COURSE_NATURE = "kcxz";
  static final String FIELD_COURSE_NAME = "kcmc";
  static final String FIELD_DISPLAY = "xsfs";
  static final String DISPLAY_ALL = "all";

  private final GradeExtractor extractor;
  private final String path;

  public GradeResource(GradeExtractor extractor, ApplicationProperties properties) {
    this.extractor = extractor;
    this.path = properties.portal().gradesPath();
  }

  @Override
  public ResourceKind kind() {
    return ResourceKind.GRADES;
  }

  @Override
  public Class<GradeSheet> type() {
    return GradeSheet.class;
  }

  @Override
  public PortalRequest request(String scope, String requestId) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put(FIELD_SEMESTER, scope == null ? "" : scope);
    form.put(FIELD_COURSE_NATURE, "");
    form.put(FIELD_COURSE_NAME, "");
    form.put(FIELD_DISPLAY, DISPLAY_ALL);
    return PortalRequest.post(path, form, requestId);
  }

  @Override
  public Extraction<GradeSheet> extract(PortalResponse response, String scope) {
    return extractor.extract(response.body());
  }

  @Override
  public void persist(SnapshotRepository repository, String owner, String scope, GradeSheet data) {
    repository.saveGrades(owner, scope, data);
  }
}
