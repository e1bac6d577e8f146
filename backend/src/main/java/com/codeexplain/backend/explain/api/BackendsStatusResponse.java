package com.codeexplain.backend.explain.api;

import com.codeexplain.backend.explain.manager.BackendHealth;
import com.codeexplain.backend.explain.provider.model.BackendDescriptor;
import java.util.List;
import java.util.Map;

public record BackendsStatusResponse(
    String strategy,
    String primaryBackend,
    List<String> fallbackBackends,
    int healthyBackends,
    Map<String, BackendHealth> health,
    List<BackendDescriptor> backends) {}
