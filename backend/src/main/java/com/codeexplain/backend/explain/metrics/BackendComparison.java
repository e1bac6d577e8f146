package com.codeexplain.backend.explain.metrics;

import java.time.Instant;
import java.util.List;

public record BackendComparison(Instant generatedAt, List<Entry> backends) {

  public record Entry(
      String backendName,
      double successRate,
      double avgResponseTimeMs,
      long totalRequests,
      double tokensPerRequest) {}
}
