package com.codeexplain.backend.explain.provider.model;

import java.util.List;
import java.util.Map;

/** Non-secret description of a backend for diagnostics endpoints. */
public record BackendDescriptor(
    String name,
    String type,
    String description,
    boolean available,
    Map<String, Object> configuration,
    List<String> capabilities) {}
