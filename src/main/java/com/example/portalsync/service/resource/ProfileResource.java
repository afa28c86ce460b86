package com.example.portalsync.service.resource;

import com.example.portalsync.adapter.portal.PortalRequest;
import com.example.portalsync.adapter.portal.PortalResponse;
import com.example.portalsync.adapter.portal.extract.ProfileExtractor;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.ProfileView;
import com.example.portalsync.domain.model.ResourceKind;
import com.example.portalsync.properties.ApplicationProperties;
import com.example.portalsync.repository.SnapshotRepository;
import org.springframework.stereotype.Component;

@Component
public class ProfileResource implements PortalResource<ProfileView> {

  private final ProfileExtractor extractor;
  private final String path;

  public ProfileResource(ProfileExtractor extractor, ApplicationProperties properties) {
    this.extractor = extractor;
    this.path = properties.portal().profilePath();
  }

  @Override
  public ResourceKind kind() {
    return ResourceKind.PROFILE;
  }

  @Override
  public Class<ProfileView> type() {
    return ProfileView.class;
  }

  @Override
  public PortalRequest request(String scope, String requestId) {
    return PortalRequest.get(path, requestId);
  }

  @Override
  public Extraction<ProfileView> extract(PortalResponse response, String scope) {
    return extractor.extract(response.body());
  }

  @Override
  public void persist(SnapshotRepository repository, String owner, String scope, ProfileView data) {
    repository.saveProfile(owner, data);
  }
}
