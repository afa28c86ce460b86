package com.example.portalsync.service.resource;

import com.example.portalsync.adapter.portal.PortalRequest;
import com.example.portalsync.adapter.portal.PortalResponse;
import com.example.portalsync.adapter.portal.extract.ScheduleExtractor;
import com.example.portalsync.adapter.portal.extract.ScheduleRequest;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.ResourceKind;
import com.example.portalsync.domain.model.ScheduleView;
import com.example.portalsync.properties.ApplicationProperties;
import com.example.portalsync.repository.SnapshotRepository;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Weekly timetable. An empty scope lets the upstream pick its current term.
 */
@Component
public class ScheduleResource implements PortalResource<ScheduleView> {

  static final String PARAM_TERM = "xnxq01id";

  private final ScheduleExtractor extractor;
  private final String path;

  public ScheduleResource(ScheduleExtractor extractor, ApplicationProperties properties) {
    this.extractor = extractor;
    this.path = properties.portal().schedulePath();
  }

  @Override
  public ResourceKind kind() {
    return ResourceKind.SCHEDULE;
  }

  @Override
  public Class<ScheduleView> type() {
    return ScheduleView.class;
  }

  @Override
  public PortalRequest request(String scope, String requestId) {
    if (scope == null || scope.isBlank()) {
      return PortalRequest.get(path, requestId);
    }
    return PortalRequest.get(path, Map.of(PARAM_TERM, scope), requestId);
  }

  @Override
  public Extraction<ScheduleView> extract(PortalResponse response, String scope) {
    return extractor.extract(new ScheduleRequest(response.body(), scope, response.url()));
  }

  @Override
  public void persist(SnapshotRepository repository, String owner, String scope, ScheduleView data) {
    repository.saveSchedule(owner, scope, data);
  }
}
