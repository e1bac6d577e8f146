package com.codeexplain.backend.explain.manager;

import java.util.List;
import java.util.Map;

public record ManagerStats(
    boolean initialized,
    SelectionStrategy strategy,
    String primaryBackend,
    List<String> fallbackBackends,
    int totalBackends,
    int healthyBackends,
    Map<String, BackendHealth> health) {}
