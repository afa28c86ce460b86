package com.example.portalsync.service.resource;

import com.example.portalsync.adapter.portal.PortalRequest;
import com.example.portalsync.adapter.portal.PortalResponse;
import com.example.portalsync.adapter.portal.extract.SemesterExtractor;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.ResourceKind;
import com.example.portalsync.domain.model.SemesterList;
import com.example.portalsync.properties.ApplicationProperties;
import com.example.portalsync.repository.SnapshotRepository;
import org.springframework.stereotype.Component;

@Component
public class SemesterResource implements PortalResource<SemesterList> {

  private final SemesterExtractor extractor;
  private final String path;

  public SemesterResource(SemesterExtractor extractor, ApplicationProperties properties) {
    this.extractor = extractor;
    this.path = properties.portal().semestersPath();
  }

  @Override
  public ResourceKind kind() {
    return ResourceKind.SEMESTERS;
  }

  @Override
  public Class<SemesterList> type() {
    return SemesterList.class;
  }

  @Override
  public PortalRequest request(String scope, String requestId) {
    return PortalRequest.get(path, requestId);
  }

  @Override
  public Extraction<SemesterList> extract(PortalResponse response, String scope) {
    return extractor.extract(response.body());
  }

  @Override
  public void persist(SnapshotRepository repository, String owner, String scope, SemesterList data) {
    repository.saveSemesters(owner, data);
  }
}
