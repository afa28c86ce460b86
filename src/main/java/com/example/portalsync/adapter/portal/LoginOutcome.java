package com.example.portalsync.adapter.portal;

import com.example.portalsync.domain.model.Diagnostic;

import java.util.Map;

/**
 * Result of one login handshake. The diagnostic never contains credential material.
 */
public record LoginOutcome(
    boolean success,
    Map<String, String> cookies,
    Diagnostic diagnostic
) {}
