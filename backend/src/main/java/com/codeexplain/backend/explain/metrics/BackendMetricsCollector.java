package com.codeexplain.backend.explain.metrics;

import com.codeexplain.backend.explain.provider.ErrorKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a bounded history of sanitized request metrics and incremental per-backend aggregates.
 * All state is guarded by a single monitor.
 */
public class BackendMetricsCollector {

  private static final Logger log = LoggerFactory.getLogger(BackendMetricsCollector.class);

  private final Object lock = new Object();
  private final Deque<RequestMetric> records = new ArrayDeque<>();
  private final Map<String, BackendAggregate> aggregates = new LinkedHashMap<>();

  private final int maxStoredRequests;
  private final Duration retention;
  private final Clock clock;
  private final BackendRequestMeters meters;
  private final List<RequestMetricListener> listeners;

  public BackendMetricsCollector(
      int maxStoredRequests,
      Duration retention,
      Clock clock,
      BackendRequestMeters meters,
      List<RequestMetricListener> listeners) {
    if (maxStoredRequests < 1) {
      throw new IllegalArgumentException("maxStoredRequests must be at least 1");
    }
    this.maxStoredRequests = maxStoredRequests;
    this.retention = Objects.requireNonNull(retention, "retention");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.meters = meters;
    this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
  }

  /** Stores the metric with its error message sanitized and returns the stored record. */
  public RequestMetric recordRequest(RequestMetric metric) {
    Objects.requireNonNull(metric, "metric");
    RequestMetric sanitized = metric.withErrorMessage(ErrorMessageSanitizer.sanitize(metric.errorMessage()));

    synchronized (lock) {
      records.addLast(sanitized);
      while (records.size() > maxStoredRequests) {
        records.removeFirst();
      }
      aggregates
          .computeIfAbsent(
              sanitized.backendName(),
              name -> new BackendAggregate(name, sanitized.timestamp()))
          .record(sanitized);
      evictExpired(clock.instant());
    }

    if (meters != null) {
      meters.record(sanitized);
    }
    if (sanitized.success()) {
      log.info(
          "Request {} on backend '{}' succeeded in {}ms",
          sanitized.requestId(),
          sanitized.backendName(),
          sanitized.responseTimeMs());
    } else {
      log.warn(
          "Request {} on backend '{}' failed in {}ms with {}: {}",
          sanitized.requestId(),
          sanitized.backendName(),
          sanitized.responseTimeMs(),
          sanitized.errorKind(),
          sanitized.errorMessage());
    }
    notifyListeners(sanitized);
    return sanitized;
  }

  public BackendComparison compare() {
    List<BackendComparison.Entry> entries = new ArrayList<>();
    synchronized (lock) {
      for (BackendAggregate aggregate : aggregates.values()) {
        double tokensPerRequest =
            aggregate.totalRequests() > 0
                ? (double) aggregate.totalTokensUsed() / aggregate.totalRequests()
                : 0.0;
        entries.add(
            new BackendComparison.Entry(
                aggregate.backendName(),
                aggregate.successRate(),
                aggregate.avgResponseTimeMs(),
                aggregate.totalRequests(),
                tokensPerRequest));
      }
    }
    return new BackendComparison(clock.instant(), List.copyOf(entries));
  }

  /** Error kind counts for one backend, or summed over all backends when {@code backend} is null. */
  public Map<ErrorKind, Long> failurePatterns(String backend) {
    Map<ErrorKind, Long> patterns = new EnumMap<>(ErrorKind.class);
    for (ErrorKind kind : ErrorKind.values()) {
      patterns.put(kind, 0L);
    }
    synchronized (lock) {
      for (BackendAggregate aggregate : aggregates.values()) {
        if (backend != null && !backend.equals(aggregate.backendName())) {
          continue;
        }
        aggregate.errorKindCounts().forEach((kind, count) -> patterns.merge(kind, count, Long::sum));
      }
    }
    return Collections.unmodifiableMap(patterns);
  }

  /** Most recent records first. */
  public List<RequestMetric> recentRequests(String backend, int limit) {
    List<RequestMetric> result = new ArrayList<>();
    synchronized (lock) {
      Iterator<RequestMetric> iterator = records.descendingIterator();
      while (iterator.hasNext() && result.size() < limit) {
        RequestMetric metric = iterator.next();
        if (backend == null || backend.equals(metric.backendName())) {
          result.add(metric);
        }
      }
    }
    return List.copyOf(result);
  }

  public BackendAggregate aggregate(String backend) {
    synchronized (lock) {
      BackendAggregate aggregate = aggregates.get(backend);
      return aggregate != null ? aggregate.copy() : null;
    }
  }

  public Map<String, BackendAggregate> aggregates() {
    Map<String, BackendAggregate> copy = new LinkedHashMap<>();
    synchronized (lock) {
      aggregates.forEach((name, aggregate) -> copy.put(name, aggregate.copy()));
    }
    return Collections.unmodifiableMap(copy);
  }

  public int storedRequests() {
    synchronized (lock) {
      return records.size();
    }
  }

  public void logSummary() {
    Map<String, BackendAggregate> snapshot = aggregates();
    if (snapshot.isEmpty()) {
      log.debug("No backend requests recorded yet");
      return;
    }
    snapshot.values()
        .forEach(
            aggregate ->
                log.info(
                    "Backend '{}': {} requests, {}% success, avg {}ms, {} tokens",
                    aggregate.backendName(),
                    aggregate.totalRequests(),
                    String.format(Locale.ROOT, "%.1f", aggregate.successRate()),
                    Math.round(aggregate.avgResponseTimeMs()),
                    aggregate.totalTokensUsed()));
  }

  public void reset() {
    synchronized (lock) {
      records.clear();
      aggregates.clear();
    }
  }

  private void evictExpired(Instant now) {
    Instant cutoff = now.minus(retention);
    records.removeIf(metric -> metric.timestamp() != null && metric.timestamp().isBefore(cutoff));
    for (BackendAggregate aggregate : aggregates.values()) {
      if (aggregate.windowStart().isBefore(cutoff)) {
        aggregate.resetWindow(cutoff);
      }
    }
  }

  private void notifyListeners(RequestMetric metric) {
    for (RequestMetricListener listener : listeners) {
      try {
        listener.onRequest(metric);
      } catch (RuntimeException ex) {
        log.warn(
            "Request metric listener {} failed: {}",
            listener,
            ErrorMessageSanitizer.sanitize(ex.getMessage()));
      }
    }
  }
}
