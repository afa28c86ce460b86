package com.example.portalsync.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record SnapshotView(
    UUID id,
    String kind,
    String scope,
    Instant fetchedAt,
    JsonNode payload
) {}
