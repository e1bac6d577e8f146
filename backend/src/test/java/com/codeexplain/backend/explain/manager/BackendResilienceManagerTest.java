package com.codeexplain.backend.explain.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeexplain.backend.explain.config.ExplainBackendsProperties;
import com.codeexplain.backend.explain.metrics.BackendMetricsCollector;
import com.codeexplain.backend.explain.metrics.RequestMetric;
import com.codeexplain.backend.explain.provider.ErrorKind;
import com.codeexplain.backend.explain.provider.ExplanationBackendException;
import com.codeexplain.backend.explain.provider.ExplanationBackendFactory;
import com.codeexplain.backend.explain.provider.ExplanationCancelledException;
import com.codeexplain.backend.explain.provider.model.BackendDescriptor;
import com.codeexplain.backend.explain.provider.model.ExplanationResult;
import com.codeexplain.backend.explain.support.MutableClock;
import com.codeexplain.backend.explain.support.ScriptedBackend;
import com.codeexplain.backend.explain.support.TestBackendSettings;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class BackendResilienceManagerTest {

  private static final Instant START = Instant.ofEpochMilli(60_000L * 29_000_000L);

  @Mock private ExplanationBackendFactory factory;

  private final MutableClock clock = new MutableClock(START);
  private final ExplainBackendsProperties properties = new ExplainBackendsProperties();
  private ExecutorService probeExecutor;
  private BackendMetricsCollector metricsCollector;
  private ScriptedBackend local;
  private ScriptedBackend external;

  @BeforeEach
  void setUp() {
    properties.setHealthMonitoringEnabled(false);
    properties.setHealthCheckTimeout(Duration.ofSeconds(2));
    probeExecutor = Executors.newCachedThreadPool();
    metricsCollector =
        new BackendMetricsCollector(100, Duration.ofHours(1), clock, null, List.of());
    local = new ScriptedBackend("local", clock);
    external = new ScriptedBackend("external", clock);
  }

  @AfterEach
  void tearDown() {
    probeExecutor.shutdownNow();
  }

  @Test
  void usesPrimaryWhenItSucceeds() {
    local.answersAfter(Duration.ofMillis(120), "from local");
    BackendResilienceManager manager = initializedManager(null);

    ExplanationResult result =
        manager.explain("What is this?", TestBackendSettings.sampleResults(), null);

    assertThat(result.explanation()).isEqualTo("from local");
    assertThat(result.backendName()).isEqualTo("local");
    assertThat(result.responseTimeMs()).isEqualTo(120L);
    assertThat(external.generateCalls()).isZero();
    assertThat(manager.healthSnapshot().get("local").lastResponseTimeMs()).isEqualTo(120L);
  }

  @Test
  void fallsBackWhenPrimaryFails() {
    local.fails(ErrorKind.NETWORK_ERROR, "connection reset");
    external.answers("from external");
    BackendResilienceManager manager = initializedManager(null);

    ExplanationResult result = manager.explain("q", TestBackendSettings.sampleResults(), null);

    assertThat(result.backendName()).isEqualTo("external");
    BackendHealth localHealth = manager.healthSnapshot().get("local");
    assertThat(localHealth.state()).isEqualTo(BackendHealthState.HEALTHY);
    assertThat(localHealth.consecutiveFailures()).isEqualTo(1);
    assertThat(localHealth.lastError()).isEqualTo("connection reset");
    assertThat(metricsCollector.recentRequests(null, 10))
        .extracting(RequestMetric::backendName, RequestMetric::success, RequestMetric::errorKind)
        .containsExactly(
            tuple("external", true, null),
            tuple("local", false, ErrorKind.NETWORK_ERROR));
  }

  @Test
  void marksBackendUnhealthyAfterConsecutiveFailures() {
    local
        .fails(ErrorKind.NETWORK_ERROR, "down 1")
        .fails(ErrorKind.NETWORK_ERROR, "down 2")
        .fails(ErrorKind.NETWORK_ERROR, "down 3");
    external.answers("a").answers("b").answers("c").answers("d");
    BackendResilienceManager manager = initializedManager(null);

    for (int i = 0; i < 4; i++) {
      manager.explain("q", TestBackendSettings.sampleResults(), null);
    }

    assertThat(manager.healthSnapshot().get("local").state())
        .isEqualTo(BackendHealthState.UNHEALTHY);
    assertThat(manager.healthyBackends()).containsExactly("external");
    assertThat(local.generateCalls()).isEqualTo(3);
    assertThat(external.generateCalls()).isEqualTo(4);
  }

  @Test
  void successResetsFailureCount() {
    local.fails(ErrorKind.NETWORK_ERROR, "blip").answers("back");
    external.answers("fallback");
    BackendResilienceManager manager = initializedManager(null);

    manager.explain("q", TestBackendSettings.sampleResults(), null);
    ExplanationResult second = manager.explain("q", TestBackendSettings.sampleResults(), null);

    assertThat(second.backendName()).isEqualTo("local");
    assertThat(manager.healthSnapshot().get("local").consecutiveFailures()).isZero();
    assertThat(manager.healthSnapshot().get("local").lastError()).isNull();
  }

  @Test
  void failsFastWhenNoBackendIsHealthy() {
    local.unavailable();
    external.unavailable();
    BackendResilienceManager manager = initializedManager(null);

    assertThatThrownBy(() -> manager.explain("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .hasMessage("No healthy backends available")
        .satisfies(
            ex -> {
              ExplanationBackendException error = (ExplanationBackendException) ex;
              assertThat(error.kind()).isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
              assertThat(error.backendName()).isEqualTo(BackendResilienceManager.MANAGER_NAME);
            });
    assertThat(local.generateCalls()).isZero();
    assertThat(external.generateCalls()).isZero();
    assertThat(metricsCollector.aggregates())
        .containsOnlyKeys(BackendResilienceManager.MANAGER_NAME);
    assertThat(metricsCollector.recentRequests(null, 10))
        .singleElement()
        .satisfies(
            metric -> {
              assertThat(metric.backendName()).isEqualTo(BackendResilienceManager.MANAGER_NAME);
              assertThat(metric.success()).isFalse();
            });
  }

  @Test
  void reportsLastErrorWhenEveryBackendFails() {
    local.fails(ErrorKind.NETWORK_ERROR, "local broke");
    external.fails(ErrorKind.AUTHENTICATION_ERROR, "bad key");
    BackendResilienceManager manager = initializedManager(null);

    assertThatThrownBy(() -> manager.explain("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .hasMessage("All backends failed. Last error: bad key")
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);

    assertThat(metricsCollector.failurePatterns(null))
        .containsEntry(ErrorKind.NETWORK_ERROR, 1L)
        .containsEntry(ErrorKind.AUTHENTICATION_ERROR, 1L)
        .containsEntry(ErrorKind.BACKEND_UNAVAILABLE, 1L);
  }

  @Test
  void unexpectedExceptionCountsAsBackendFailure() {
    local.throwing(new IllegalStateException("boom"));
    external.answers("ok");
    BackendResilienceManager manager = initializedManager(null);

    ExplanationResult result = manager.explain("q", TestBackendSettings.sampleResults(), null);

    assertThat(result.backendName()).isEqualTo("external");
    assertThat(metricsCollector.failurePatterns("local"))
        .containsEntry(ErrorKind.BACKEND_UNAVAILABLE, 1L);
  }

  @Test
  void backendThatCannotBeCreatedStartsUnhealthy() {
    when(factory.create(eq("local"), any()))
        .thenThrow(
            new ExplanationBackendException(
                "Local model name must be a non-empty string",
                ErrorKind.CONFIGURATION_ERROR,
                "local"));
    when(factory.create(eq("external"), any())).thenReturn(external);
    external.answers("ok");
    BackendResilienceManager manager = newManager(null);
    manager.initialize();

    BackendHealth localHealth = manager.healthSnapshot().get("local");
    assertThat(localHealth.state()).isEqualTo(BackendHealthState.UNHEALTHY);
    assertThat(localHealth.consecutiveFailures()).isEqualTo(3);
    assertThat(localHealth.lastError()).contains("model name");
    assertThat(manager.explain("q", TestBackendSettings.sampleResults(), null).backendName())
        .isEqualTo("external");
    assertThat(manager.describeBackends()).extracting(BackendDescriptor::name).containsExactly("external");
  }

  @Test
  void primaryFallbackKeepsConfiguredOrder() {
    BackendResilienceManager manager = initializedManager(null);

    assertThat(manager.selectCandidates()).containsExactly("local", "external");
  }

  @Test
  void fastestFirstOrdersByLastResponseTime() {
    properties.setSelectionStrategy(SelectionStrategy.FASTEST_FIRST);
    local.probeLatency(Duration.ofMillis(500));
    external.probeLatency(Duration.ofMillis(50));
    BackendResilienceManager manager = initializedManager(null);

    assertThat(manager.selectCandidates()).containsExactly("local", "external");

    manager.checkHealth();

    assertThat(manager.selectCandidates()).containsExactly("external", "local");
  }

  @Test
  void fastestFirstPutsUnmeasuredBackendsLast() {
    properties.setSelectionStrategy(SelectionStrategy.FASTEST_FIRST);
    external.probeLatency(Duration.ofMillis(80));
    BackendResilienceManager manager = initializedManager(null);

    manager.checkHealth("external");

    assertThat(manager.selectCandidates()).containsExactly("external", "local");
  }

  @Test
  void roundRobinRotatesEveryMinute() {
    properties.setSelectionStrategy(SelectionStrategy.ROUND_ROBIN);
    BackendResilienceManager manager = initializedManager(null);

    clock.set(Instant.ofEpochMilli(60_000L * 10));
    assertThat(manager.selectCandidates()).containsExactly("local", "external");

    clock.set(Instant.ofEpochMilli(60_000L * 11 + 59_999));
    assertThat(manager.selectCandidates()).containsExactly("external", "local");
  }

  @Test
  void healthCheckRecoversUnhealthyBackend() {
    local.unavailable();
    BackendResilienceManager manager = initializedManager(null);
    assertThat(manager.healthyBackends()).containsExactly("external");

    local.probeSucceeds(true);
    BackendHealth health = manager.checkHealth("local");

    assertThat(health.state()).isEqualTo(BackendHealthState.HEALTHY);
    assertThat(health.consecutiveFailures()).isZero();
    assertThat(manager.healthyBackends()).containsExactly("local", "external");
  }

  @Test
  void failedProbeCountsAsConsecutiveFailure() {
    BackendResilienceManager manager = initializedManager(null);
    local.probeSucceeds(false);

    BackendHealth health = manager.checkHealth("local");

    assertThat(health.consecutiveFailures()).isEqualTo(1);
    assertThat(health.lastError()).isEqualTo("Backend reported unavailable");
  }

  @Test
  void slowProbeTimesOut() {
    properties.setHealthCheckTimeout(Duration.ofMillis(50));
    local.probeBlocks(Duration.ofSeconds(5));
    BackendResilienceManager manager = initializedManager(null);

    BackendHealth health = manager.checkHealth("local");

    assertThat(health.lastError()).isEqualTo("Health check timed out after 50ms");
    assertThat(health.consecutiveFailures()).isEqualTo(1);
  }

  @Test
  void checkingUnknownBackendIsRejected() {
    BackendResilienceManager manager = initializedManager(null);

    assertThatThrownBy(() -> manager.checkHealth("missing"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown backend: missing");
  }

  @Test
  void cancellationStopsFallback() {
    local.throwing(new ExplanationCancelledException("interrupted", null));
    external.answers("never");
    BackendResilienceManager manager = initializedManager(null);

    assertThatThrownBy(() -> manager.explain("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationCancelledException.class);
    assertThat(external.generateCalls()).isZero();
  }

  @Test
  void explainInitializesLazily() {
    when(factory.create(eq("local"), any())).thenReturn(local);
    when(factory.create(eq("external"), any())).thenReturn(external);
    local.answers("lazy");
    BackendResilienceManager manager = newManager(null);

    assertThat(manager.isInitialized()).isFalse();
    assertThat(manager.explain("q", TestBackendSettings.sampleResults(), null).explanation())
        .isEqualTo("lazy");
    assertThat(manager.isInitialized()).isTrue();
  }

  @Test
  void schedulesHealthChecksAndSummaries() {
    properties.setHealthMonitoringEnabled(true);
    TaskScheduler scheduler = mock(TaskScheduler.class);
    ScheduledFuture<?> future = mock(ScheduledFuture.class);
    doReturn(future)
        .when(scheduler)
        .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
    BackendResilienceManager manager = initializedManager(scheduler);

    ArgumentCaptor<Runnable> healthTask = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler)
        .scheduleWithFixedDelay(
            healthTask.capture(), eq(START.plus(Duration.ofMinutes(1))), eq(Duration.ofMinutes(1)));
    verify(scheduler)
        .scheduleWithFixedDelay(
            any(Runnable.class), eq(START.plus(Duration.ofMinutes(5))), eq(Duration.ofMinutes(5)));
    healthTask.getValue().run();
    assertThat(local.probeCalls()).isEqualTo(1);
    assertThat(external.probeCalls()).isEqualTo(1);

    manager.shutdown();
    verify(future, times(2)).cancel(true);
  }

  @Test
  void shutdownCleansUpOnceAndRejectsRequests() {
    BackendResilienceManager manager = initializedManager(null);

    manager.shutdown();
    manager.shutdown();

    assertThat(local.cleanupCalls()).isEqualTo(1);
    assertThat(external.cleanupCalls()).isEqualTo(1);
    assertThat(manager.isInitialized()).isFalse();
    assertThatThrownBy(() -> manager.explain("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
  }

  @Test
  void disabledMonitoringSchedulesNothing() {
    TaskScheduler scheduler = mock(TaskScheduler.class);

    initializedManager(scheduler);

    verify(scheduler, never())
        .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
  }

  private BackendResilienceManager initializedManager(TaskScheduler scheduler) {
    when(factory.create(eq("local"), any())).thenReturn(local);
    when(factory.create(eq("external"), any())).thenReturn(external);
    BackendResilienceManager manager = newManager(scheduler);
    manager.initialize();
    return manager;
  }

  private BackendResilienceManager newManager(TaskScheduler scheduler) {
    return new BackendResilienceManager(
        properties, factory, metricsCollector, scheduler, probeExecutor, clock);
  }
}
