package com.codeexplain.backend.explain.config;

import com.codeexplain.backend.explain.manager.BackendResilienceManager;
import com.codeexplain.backend.explain.metrics.BackendMetricsCollector;
import com.codeexplain.backend.explain.metrics.BackendRequestMeters;
import com.codeexplain.backend.explain.metrics.RequestMetricListener;
import com.codeexplain.backend.explain.provider.ExplanationBackendFactory;
import com.codeexplain.backend.explain.provider.local.ProcessLauncher;
import com.codeexplain.backend.explain.retry.RetryEngine;
import com.codeexplain.backend.explain.service.ExplanationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(ExplainBackendsProperties.class)
public class ExplainConfiguration {

  @Bean
  public Clock explainClock() {
    return Clock.systemUTC();
  }

  @Bean
  public RetryEngine explainRetryEngine() {
    return new RetryEngine();
  }

  @Bean
  public ProcessLauncher explainProcessLauncher() {
    return ProcessLauncher.system();
  }

  @Bean
  public ExplanationBackendFactory explanationBackendFactory(
      RetryEngine explainRetryEngine,
      ObjectProvider<WebClient.Builder> webClientBuilder,
      ObjectMapper objectMapper,
      ProcessLauncher explainProcessLauncher) {
    return new ExplanationBackendFactory(
        explainRetryEngine,
        webClientBuilder.getIfAvailable(WebClient::builder),
        objectMapper,
        explainProcessLauncher);
  }

  @Bean
  public BackendRequestMeters backendRequestMeters(MeterRegistry meterRegistry) {
    return new BackendRequestMeters(meterRegistry);
  }

  @Bean
  public BackendMetricsCollector backendMetricsCollector(
      ExplainBackendsProperties properties,
      Clock explainClock,
      BackendRequestMeters backendRequestMeters,
      ObjectProvider<RequestMetricListener> listeners) {
    ExplainBackendsProperties.Metrics metrics = properties.getMetrics();
    return new BackendMetricsCollector(
        metrics.getMaxStoredRequests(),
        metrics.getRetention(),
        explainClock,
        backendRequestMeters,
        listeners.orderedStream().toList());
  }

  @Bean(name = "explainHealthScheduler")
  public ThreadPoolTaskScheduler explainHealthScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("explain-health-");
    scheduler.setDaemon(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Bean(name = "explainProbeExecutor", destroyMethod = "shutdownNow")
  public ExecutorService explainProbeExecutor() {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("explain-probe-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };
    return Executors.newCachedThreadPool(threadFactory);
  }

  @Bean(initMethod = "initialize", destroyMethod = "shutdown")
  public BackendResilienceManager backendResilienceManager(
      ExplainBackendsProperties properties,
      ExplanationBackendFactory explanationBackendFactory,
      BackendMetricsCollector backendMetricsCollector,
      @Qualifier("explainHealthScheduler") ThreadPoolTaskScheduler explainHealthScheduler,
      @Qualifier("explainProbeExecutor") ExecutorService explainProbeExecutor,
      Clock explainClock) {
    return new BackendResilienceManager(
        properties,
        explanationBackendFactory,
        backendMetricsCollector,
        explainHealthScheduler,
        explainProbeExecutor,
        explainClock);
  }

  @Bean
  public ExplanationService explanationService(BackendResilienceManager backendResilienceManager) {
    return new ExplanationService(backendResilienceManager);
  }
}
