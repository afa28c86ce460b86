package com.example.portalsync.service.resource;

import com.example.portalsync.adapter.portal.PortalRequest;
import com.example.portalsync.adapter.portal.PortalResponse;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.ResourceKind;
import com.example.portalsync.repository.SnapshotRepository;

/**
 * Everything the sync orchestration needs to know about one kind of upstream page:
 * how to request it, how to read it and how to store it.
 *
 * @param <T> normalized payload type
 */
public interface PortalResource<T> {

  ResourceKind kind();

  Class<T> type();

  PortalRequest request(String scope, String requestId);

  /**
   * @throws com.example.portalsync.exception.SessionInvalidException when the page is the login form
   */
  Extraction<T> extract(PortalResponse response, String scope);

  void persist(SnapshotRepository repository, String owner, String scope, T data);
}
