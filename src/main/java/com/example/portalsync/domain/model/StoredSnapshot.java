package com.example.portalsync.domain.model;

import java.time.Instant;

/**
 * A durable snapshot payload read back into its typed form.
 */
public record StoredSnapshot<T>(T data, Instant fetchedAt) {}
