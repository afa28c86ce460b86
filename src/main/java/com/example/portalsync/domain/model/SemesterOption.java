package com.example.portalsync.domain.model;

public record SemesterOption(String value, String label) {}
