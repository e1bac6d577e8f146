package com.codeexplain.backend.explain.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;

/** Micrometer view of backend requests. */
public class BackendRequestMeters {

  static final String REQUESTS = "explain.backend.requests";
  static final String LATENCY = "explain.backend.latency";
  static final String TOKENS = "explain.backend.tokens";

  private final MeterRegistry meterRegistry;

  public BackendRequestMeters(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  void record(RequestMetric metric) {
    String backend = metric.backendName() != null ? metric.backendName() : "unknown";
    String outcome = metric.success() ? "success" : "failure";
    String kind = metric.errorKind() != null ? metric.errorKind().name() : "none";
    meterRegistry
        .counter(REQUESTS, "backend", backend, "outcome", outcome, "kind", kind)
        .increment();
    meterRegistry
        .timer(LATENCY, "backend", backend)
        .record(Math.max(0L, metric.responseTimeMs()), TimeUnit.MILLISECONDS);
    if (metric.tokenUsage() != null && metric.tokenUsage().totalOrZero() > 0) {
      meterRegistry.summary(TOKENS, "backend", backend).record(metric.tokenUsage().totalOrZero());
    }
  }
}
