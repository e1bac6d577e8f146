package com.codeexplain.backend.explain.metrics;

import com.codeexplain.backend.explain.provider.ErrorKind;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Running totals for one backend. Instances handed out by the collector are copies. */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class BackendAggregate {

  private final String backendName;
  private long totalRequests;
  private long successfulRequests;
  private long failedRequests;
  private double successRate;
  private double avgResponseTimeMs;
  private long totalTokensUsed;
  private final EnumMap<ErrorKind, Long> errorKindCounts = new EnumMap<>(ErrorKind.class);
  private Instant windowStart;
  private Instant windowEnd;
  private Instant lastUpdated;

  BackendAggregate(String backendName, Instant now) {
    this.backendName = backendName;
    this.windowStart = now;
    this.windowEnd = now;
    this.lastUpdated = now;
  }

  private BackendAggregate(BackendAggregate other) {
    this.backendName = other.backendName;
    this.totalRequests = other.totalRequests;
    this.successfulRequests = other.successfulRequests;
    this.failedRequests = other.failedRequests;
    this.successRate = other.successRate;
    this.avgResponseTimeMs = other.avgResponseTimeMs;
    this.totalTokensUsed = other.totalTokensUsed;
    this.errorKindCounts.putAll(other.errorKindCounts);
    this.windowStart = other.windowStart;
    this.windowEnd = other.windowEnd;
    this.lastUpdated = other.lastUpdated;
  }

  void record(RequestMetric metric) {
    totalRequests++;
    if (metric.success()) {
      successfulRequests++;
    } else {
      failedRequests++;
      if (metric.errorKind() != null) {
        errorKindCounts.merge(metric.errorKind(), 1L, Long::sum);
      }
    }
    successRate = (double) successfulRequests / totalRequests * 100.0;
    avgResponseTimeMs =
        (avgResponseTimeMs * (totalRequests - 1) + metric.responseTimeMs()) / totalRequests;
    if (metric.tokenUsage() != null) {
      totalTokensUsed += metric.tokenUsage().totalOrZero();
    }
    windowEnd = metric.timestamp();
    lastUpdated = metric.timestamp();
  }

  void resetWindow(Instant newStart) {
    windowStart = newStart;
  }

  BackendAggregate copy() {
    return new BackendAggregate(this);
  }

  public String backendName() {
    return backendName;
  }

  public long totalRequests() {
    return totalRequests;
  }

  public long successfulRequests() {
    return successfulRequests;
  }

  public long failedRequests() {
    return failedRequests;
  }

  /** Percentage in {@code [0, 100]}. */
  public double successRate() {
    return successRate;
  }

  public double avgResponseTimeMs() {
    return avgResponseTimeMs;
  }

  public long totalTokensUsed() {
    return totalTokensUsed;
  }

  public Map<ErrorKind, Long> errorKindCounts() {
    return Collections.unmodifiableMap(new EnumMap<>(errorKindCounts));
  }

  public Instant windowStart() {
    return windowStart;
  }

  public Instant windowEnd() {
    return windowEnd;
  }

  public Instant lastUpdated() {
    return lastUpdated;
  }
}
