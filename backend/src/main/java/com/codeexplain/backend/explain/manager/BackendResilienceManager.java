package com.codeexplain.backend.explain.manager;

import com.codeexplain.backend.explain.config.ExplainBackendsProperties;
import com.codeexplain.backend.explain.metrics.BackendMetricsCollector;
import com.codeexplain.backend.explain.metrics.ErrorMessageSanitizer;
import com.codeexplain.backend.explain.metrics.RequestMetric;
import com.codeexplain.backend.explain.provider.ErrorKind;
import com.codeexplain.backend.explain.provider.ExplanationBackend;
import com.codeexplain.backend.explain.provider.ExplanationBackendException;
import com.codeexplain.backend.explain.provider.ExplanationBackendFactory;
import com.codeexplain.backend.explain.provider.ExplanationCancelledException;
import com.codeexplain.backend.explain.provider.model.BackendDescriptor;
import com.codeexplain.backend.explain.provider.model.ExplainOptions;
import com.codeexplain.backend.explain.provider.model.ExplanationResult;
import com.codeexplain.backend.explain.provider.model.SearchResult;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Routes explanation requests over the configured backends. Picks candidates by the selection
 * strategy, falls back on failure and keeps a health record per backend from call outcomes and
 * periodic probes.
 */
public class BackendResilienceManager {

  private static final Logger log = LoggerFactory.getLogger(BackendResilienceManager.class);

  public static final String MANAGER_NAME = "manager";
  static final long ROUND_ROBIN_WINDOW_MS = 60_000L;

  private final ExplainBackendsProperties properties;
  private final ExplanationBackendFactory backendFactory;
  private final BackendMetricsCollector metricsCollector;
  private final TaskScheduler taskScheduler;
  private final ExecutorService probeExecutor;
  private final Clock clock;

  private final ReentrantLock stateLock = new ReentrantLock();
  private final Map<String, ExplanationBackend> backends = new LinkedHashMap<>();
  private final Map<String, BackendHealth> health = new LinkedHashMap<>();
  private final AtomicBoolean healthCheckRunning = new AtomicBoolean();
  private final AtomicBoolean shutdown = new AtomicBoolean();
  private volatile boolean initialized;
  private ScheduledFuture<?> healthCheckTask;
  private ScheduledFuture<?> metricsSummaryTask;

  public BackendResilienceManager(
      ExplainBackendsProperties properties,
      ExplanationBackendFactory backendFactory,
      BackendMetricsCollector metricsCollector,
      TaskScheduler taskScheduler,
      ExecutorService probeExecutor,
      Clock clock) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.backendFactory = Objects.requireNonNull(backendFactory, "backendFactory");
    this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector");
    this.taskScheduler = taskScheduler;
    this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public void initialize() {
    stateLock.lock();
    try {
      if (initialized) {
        return;
      }
      if (shutdown.get()) {
        throw new IllegalStateException("Backend manager has been shut down");
      }
      List<String> names = properties.orderedBackendNames();
      log.info(
          "Initializing explanation backends {} with strategy {}",
          names,
          properties.getSelectionStrategy().id());
      for (String name : names) {
        health.put(name, BackendHealth.unknown(clock.instant()));
        createBackend(name);
      }
      initialized = true;
    } finally {
      stateLock.unlock();
    }

    List<String> healthy = healthyBackends();
    if (healthy.isEmpty()) {
      log.warn("No explanation backend is healthy after initialization");
    } else {
      log.info("Healthy explanation backends: {}", healthy);
    }
    scheduleBackgroundTasks();
  }

  private void createBackend(String name) {
    ExplainBackendsProperties.Backend settings = properties.getBackends().get(name);
    try {
      ExplanationBackend backend = backendFactory.create(name, settings);
      backends.put(name, backend);
      health.put(name, BackendHealth.initial(clock.instant(), backend.isAvailable()));
    } catch (RuntimeException ex) {
      log.error(
          "Failed to create explanation backend '{}': {}",
          name,
          ErrorMessageSanitizer.sanitize(ex.getMessage()));
      health.put(
          name,
          BackendHealth.creationFailed(
              clock.instant(), ex.getMessage(), properties.getMaxConsecutiveFailures()));
    }
  }

  private void scheduleBackgroundTasks() {
    if (taskScheduler == null || !properties.isHealthMonitoringEnabled()) {
      return;
    }
    Duration interval = properties.getHealthCheckInterval();
    healthCheckTask =
        taskScheduler.scheduleWithFixedDelay(
            this::runScheduledHealthChecks, clock.instant().plus(interval), interval);
    Duration summaryInterval = properties.getMetrics().getSummaryInterval();
    metricsSummaryTask =
        taskScheduler.scheduleWithFixedDelay(
            metricsCollector::logSummary, clock.instant().plus(summaryInterval), summaryInterval);
    log.debug("Backend health checks scheduled every {}", interval);
  }

  /**
   * Tries the selected backends in order and returns the first successful explanation.
   *
   * @throws ExplanationBackendException with {@link ErrorKind#BACKEND_UNAVAILABLE} when no backend
   *     is healthy or all of them failed
   * @throws ExplanationCancelledException when the calling thread is interrupted
   */
  public ExplanationResult explain(
      String query, List<SearchResult> results, ExplainOptions options) {
    ensureReady();
    String requestId = "req_" + clock.millis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    int queryLength = query != null ? query.length() : 0;
    int resultCount = results != null ? results.size() : 0;

    List<String> candidates = selectCandidates();
    log.info("Request {} candidates {} ({} results)", requestId, candidates, resultCount);
    if (candidates.isEmpty()) {
      String message = "No healthy backends available";
      recordManagerFailure(requestId, queryLength, resultCount, 0L, message);
      throw new ExplanationBackendException(
          message, ErrorKind.BACKEND_UNAVAILABLE, MANAGER_NAME);
    }

    long requestStarted = clock.millis();
    RuntimeException lastError = null;
    for (String name : candidates) {
      if (Thread.currentThread().isInterrupted()) {
        throw new ExplanationCancelledException("Request " + requestId + " cancelled", null);
      }
      ExplanationBackend backend = backend(name);
      if (backend == null) {
        continue;
      }
      long attemptStarted = clock.millis();
      try {
        ExplanationResult result = backend.generate(query, results, options);
        long elapsed = clock.millis() - attemptStarted;
        recordSuccess(name, elapsed);
        metricsCollector.recordRequest(
            RequestMetric.success(
                requestId,
                name,
                clock.instant(),
                queryLength,
                resultCount,
                elapsed,
                result.model(),
                result.explanation() != null ? result.explanation().length() : null,
                result.usage()));
        return result.withBackend(name, elapsed);
      } catch (ExplanationCancelledException ex) {
        log.info("Request {} cancelled while using backend '{}'", requestId, name);
        throw ex;
      } catch (RuntimeException ex) {
        long elapsed = clock.millis() - attemptStarted;
        ErrorKind kind =
            ex instanceof ExplanationBackendException backendError
                ? backendError.kind()
                : ErrorKind.BACKEND_UNAVAILABLE;
        recordFailure(name, ex.getMessage());
        metricsCollector.recordRequest(
            RequestMetric.failure(
                requestId,
                name,
                clock.instant(),
                queryLength,
                resultCount,
                elapsed,
                kind,
                ex.getMessage()));
        log.warn("Backend '{}' failed for request {}, trying next candidate", name, requestId);
        lastError = ex;
      }
    }

    String lastMessage = lastError != null ? lastError.getMessage() : "no backend could be called";
    String message = "All backends failed. Last error: " + lastMessage;
    recordManagerFailure(
        requestId, queryLength, resultCount, clock.millis() - requestStarted, message);
    throw new ExplanationBackendException(
        message, ErrorKind.BACKEND_UNAVAILABLE, MANAGER_NAME, lastError);
  }

  /** Healthy backends in the order the configured strategy would try them. */
  public List<String> selectCandidates() {
    List<String> healthy = healthyBackends();
    SelectionStrategy strategy = properties.getSelectionStrategy();
    if (healthy.size() < 2 || strategy == null) {
      return healthy;
    }
    return switch (strategy) {
      case PRIMARY_FALLBACK -> healthy;
      case FASTEST_FIRST -> {
        Map<String, BackendHealth> snapshot = healthSnapshot();
        List<String> ordered = new ArrayList<>(healthy);
        ordered.sort(
            Comparator.comparingLong(
                name -> {
                  Long time = snapshot.get(name).lastResponseTimeMs();
                  return time != null ? time : Long.MAX_VALUE;
                }));
        yield List.copyOf(ordered);
      }
      case ROUND_ROBIN -> {
        int offset = (int) ((clock.millis() / ROUND_ROBIN_WINDOW_MS) % healthy.size());
        List<String> rotated = new ArrayList<>(healthy.subList(offset, healthy.size()));
        rotated.addAll(healthy.subList(0, offset));
        yield List.copyOf(rotated);
      }
    };
  }

  /** Probes every backend now. Skipped when another health check is already running. */
  public void checkHealth() {
    ensureReady();
    runHealthChecks();
  }

  /** Probes one backend now and returns its updated health. */
  public BackendHealth checkHealth(String name) {
    ensureReady();
    if (!healthSnapshot().containsKey(name)) {
      throw new IllegalArgumentException("Unknown backend: " + name);
    }
    return probe(name);
  }

  void runScheduledHealthChecks() {
    try {
      runHealthChecks();
    } catch (RuntimeException ex) {
      log.error("Backend health check run failed", ex);
    }
  }

  private void runHealthChecks() {
    if (!healthCheckRunning.compareAndSet(false, true)) {
      log.debug("Backend health check already running, skipping");
      return;
    }
    try {
      for (String name : healthSnapshot().keySet()) {
        if (shutdown.get() || Thread.currentThread().isInterrupted()) {
          return;
        }
        probe(name);
      }
    } finally {
      healthCheckRunning.set(false);
    }
  }

  private BackendHealth probe(String name) {
    ExplanationBackend backend = backend(name);
    if (backend == null) {
      return healthSnapshot().get(name);
    }
    Duration timeout = properties.getHealthCheckTimeout();
    long started = clock.millis();
    Future<Boolean> future =
        probeExecutor.submit(() -> backend.validateConfiguration() && backend.isAvailable());
    boolean healthy;
    String error = null;
    try {
      healthy = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!healthy) {
        error = "Backend reported unavailable";
      }
    } catch (TimeoutException ex) {
      future.cancel(true);
      healthy = false;
      error = "Health check timed out after " + timeout.toMillis() + "ms";
    } catch (ExecutionException ex) {
      healthy = false;
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      error = "Health check failed: " + ErrorMessageSanitizer.sanitize(cause.getMessage());
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return healthSnapshot().get(name);
    }

    if (healthy) {
      return recordSuccess(name, clock.millis() - started);
    }
    log.warn("Health check for backend '{}' failed: {}", name, error);
    return recordFailure(name, error);
  }

  private BackendHealth recordSuccess(String name, long responseTimeMs) {
    stateLock.lock();
    try {
      BackendHealth previous = health.get(name);
      if (previous == null) {
        return null;
      }
      BackendHealth next = previous.recordSuccess(clock.instant(), responseTimeMs);
      health.put(name, next);
      if (!previous.healthy()) {
        log.info("Backend '{}' is healthy again", name);
      }
      return next;
    } finally {
      stateLock.unlock();
    }
  }

  private BackendHealth recordFailure(String name, String error) {
    stateLock.lock();
    try {
      BackendHealth previous = health.get(name);
      if (previous == null) {
        return null;
      }
      BackendHealth next =
          previous.recordFailure(clock.instant(), error, properties.getMaxConsecutiveFailures());
      health.put(name, next);
      if (previous.state() != BackendHealthState.UNHEALTHY
          && next.state() == BackendHealthState.UNHEALTHY) {
        log.warn(
            "Backend '{}' marked unhealthy after {} consecutive failures",
            name,
            next.consecutiveFailures());
      }
      return next;
    } finally {
      stateLock.unlock();
    }
  }

  private void recordManagerFailure(
      String requestId, int queryLength, int resultCount, long elapsedMs, String message) {
    metricsCollector.recordRequest(
        RequestMetric.failure(
            requestId,
            MANAGER_NAME,
            clock.instant(),
            queryLength,
            resultCount,
            elapsedMs,
            ErrorKind.BACKEND_UNAVAILABLE,
            message));
  }

  public Map<String, BackendHealth> healthSnapshot() {
    stateLock.lock();
    try {
      return Collections.unmodifiableMap(new LinkedHashMap<>(health));
    } finally {
      stateLock.unlock();
    }
  }

  public List<String> healthyBackends() {
    stateLock.lock();
    try {
      List<String> healthy = new ArrayList<>();
      health.forEach(
          (name, state) -> {
            if (state.healthy() && backends.containsKey(name)) {
              healthy.add(name);
            }
          });
      return List.copyOf(healthy);
    } finally {
      stateLock.unlock();
    }
  }

  public List<BackendDescriptor> describeBackends() {
    List<ExplanationBackend> snapshot;
    stateLock.lock();
    try {
      snapshot = List.copyOf(backends.values());
    } finally {
      stateLock.unlock();
    }
    return snapshot.stream().map(ExplanationBackend::describe).toList();
  }

  public ManagerStats stats() {
    Map<String, BackendHealth> snapshot = healthSnapshot();
    return new ManagerStats(
        initialized,
        properties.getSelectionStrategy(),
        properties.getPrimaryBackend(),
        properties.getFallbackBackends() != null
            ? List.copyOf(properties.getFallbackBackends())
            : List.of(),
        snapshot.size(),
        healthyBackends().size(),
        snapshot);
  }

  public boolean isInitialized() {
    return initialized;
  }

  /** Stops background tasks and cleans up every backend. Only the first call has an effect. */
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down explanation backends");
    cancel(healthCheckTask);
    cancel(metricsSummaryTask);

    List<ExplanationBackend> toClean;
    stateLock.lock();
    try {
      toClean = new ArrayList<>(backends.values());
      backends.clear();
      health.clear();
      initialized = false;
    } finally {
      stateLock.unlock();
    }
    for (ExplanationBackend backend : toClean) {
      try {
        backend.cleanup();
      } catch (RuntimeException ex) {
        log.warn(
            "Cleanup of backend '{}' failed: {}",
            backend.name(),
            ErrorMessageSanitizer.sanitize(ex.getMessage()));
      }
    }
  }

  private static void cancel(ScheduledFuture<?> task) {
    if (task != null) {
      task.cancel(true);
    }
  }

  private ExplanationBackend backend(String name) {
    stateLock.lock();
    try {
      return backends.get(name);
    } finally {
      stateLock.unlock();
    }
  }

  private void ensureReady() {
    if (shutdown.get()) {
      throw new ExplanationBackendException(
          "Backend manager has been shut down", ErrorKind.BACKEND_UNAVAILABLE, MANAGER_NAME);
    }
    if (!initialized) {
      initialize();
    }
  }
}
