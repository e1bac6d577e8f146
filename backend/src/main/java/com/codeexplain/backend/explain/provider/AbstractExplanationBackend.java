package com.codeexplain.backend.explain.provider;

import com.codeexplain.backend.explain.config.ExplainBackendsProperties;
import com.codeexplain.backend.explain.metrics.ErrorMessageSanitizer;
import com.codeexplain.backend.explain.provider.model.BackendDescriptor;
import com.codeexplain.backend.explain.provider.model.ExplainOptions;
import com.codeexplain.backend.explain.provider.model.ExplanationResult;
import com.codeexplain.backend.explain.provider.model.SearchResult;
import com.codeexplain.backend.explain.retry.CallContext;
import com.codeexplain.backend.explain.retry.RetryEngine;
import com.codeexplain.backend.explain.retry.RetrySettings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Shared plumbing for backends: input and settings validation, the availability flag and
 * operation logging. Subclasses implement the actual call and the availability probe.
 */
public abstract class AbstractExplanationBackend implements ExplanationBackend {

  protected final Logger log = LoggerFactory.getLogger(getClass());

  private final String name;
  protected final ExplainBackendsProperties.Backend settings;
  protected final RetryEngine retryEngine;
  private volatile boolean available;

  protected AbstractExplanationBackend(
      String name, ExplainBackendsProperties.Backend settings, RetryEngine retryEngine) {
    this.name = Objects.requireNonNull(name, "name");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.retryEngine = Objects.requireNonNull(retryEngine, "retryEngine");
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public boolean isAvailable() {
    return available;
  }

  @Override
  public final ExplanationResult generate(
      String query, List<SearchResult> results, ExplainOptions options) {
    validateQuery(query);
    validateSearchResults(results);
    if (!available) {
      throw failure(
          name + " backend is not available. Run validateConfiguration() first.",
          ErrorKind.BACKEND_UNAVAILABLE);
    }
    ExplainOptions effectiveOptions = options != null ? options : ExplainOptions.defaults();
    long startedAt = System.nanoTime();
    log.debug("Backend '{}' generating explanation for {} results", name, results.size());
    try {
      ExplanationResult result = doGenerate(query, results, effectiveOptions);
      log.info(
          "Backend '{}' produced explanation in {}ms",
          name,
          Duration.ofNanos(System.nanoTime() - startedAt).toMillis());
      return result;
    } catch (ExplanationBackendException ex) {
      log.warn(
          "Backend '{}' failed after {}ms with {}: {}",
          name,
          Duration.ofNanos(System.nanoTime() - startedAt).toMillis(),
          ex.kind(),
          ErrorMessageSanitizer.sanitize(ex.getMessage()));
      throw ex;
    }
  }

  @Override
  public final boolean validateConfiguration() {
    validateCommonSettings();
    validateBackendSettings();
    probeAndRemember();
    return true;
  }

  @Override
  public final boolean refreshAvailability() {
    return probeAndRemember();
  }

  @Override
  public BackendDescriptor describe() {
    return new BackendDescriptor(
        name, type(), description(), available, describeConfiguration(), capabilities());
  }

  @Override
  public final void cleanup() {
    try {
      releaseResources();
    } catch (RuntimeException ex) {
      log.warn(
          "Cleanup of backend '{}' failed: {}",
          name,
          ErrorMessageSanitizer.sanitize(ex.getMessage()));
    } finally {
      available = false;
    }
  }

  protected abstract ExplanationResult doGenerate(
      String query, List<SearchResult> results, ExplainOptions options);

  protected abstract void validateBackendSettings();

  /** Throws an {@link ExplanationBackendException} when the backend cannot be reached. */
  protected abstract void probeAvailability();

  protected abstract String type();

  protected abstract String description();

  protected abstract Map<String, Object> describeConfiguration();

  protected abstract List<String> capabilities();

  protected void releaseResources() {}

  protected CallContext newCallContext(String query, int resultCount) {
    RetrySettings retrySettings =
        RetrySettings.forBackend(settings.getMaxRetries(), settings.getRetryDelay());
    return CallContext.create(
        type(), query, resultCount, retrySettings, retryEngine.clock().instant());
  }

  protected Duration effectiveTimeout(ExplainOptions options) {
    if (options != null && options.timeout() != null && !options.timeout().isNegative()
        && !options.timeout().isZero()) {
      return options.timeout();
    }
    return settings.getTimeout();
  }

  protected ExplanationBackendException failure(String message, ErrorKind kind) {
    return new ExplanationBackendException(message, kind, name);
  }

  protected ExplanationBackendException failure(String message, ErrorKind kind, Throwable cause) {
    return new ExplanationBackendException(message, kind, name, cause);
  }

  private boolean probeAndRemember() {
    try {
      probeAvailability();
      available = true;
      log.info("Backend '{}' is available", name);
    } catch (ExplanationCancelledException ex) {
      available = false;
      throw ex;
    } catch (RuntimeException ex) {
      available = false;
      log.warn(
          "Backend '{}' is not available: {}",
          name,
          ErrorMessageSanitizer.sanitize(ex.getMessage()));
    }
    return available;
  }

  private void validateCommonSettings() {
    Duration timeout = settings.getTimeout();
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw failure("Timeout must be a positive duration", ErrorKind.CONFIGURATION_ERROR);
    }
    if (settings.getMaxRetries() < 0) {
      throw failure("Max retries must be a non-negative number", ErrorKind.CONFIGURATION_ERROR);
    }
    Duration retryDelay = settings.getRetryDelay();
    if (retryDelay == null || retryDelay.isNegative()) {
      throw failure("Retry delay must be a non-negative duration", ErrorKind.CONFIGURATION_ERROR);
    }
  }

  private void validateQuery(String query) {
    if (!StringUtils.hasText(query)) {
      throw failure("Query must be a non-empty string", ErrorKind.CONFIGURATION_ERROR);
    }
  }

  private void validateSearchResults(List<SearchResult> results) {
    if (results == null) {
      throw failure("Search results must be a list", ErrorKind.CONFIGURATION_ERROR);
    }
    for (int i = 0; i < results.size(); i++) {
      SearchResult result = results.get(i);
      if (result == null) {
        throw failure("Search result at index " + i + " is missing", ErrorKind.CONFIGURATION_ERROR);
      }
      if (!StringUtils.hasText(result.filePath())) {
        throw failure(
            "Search result at index " + i + " is missing filePath",
            ErrorKind.CONFIGURATION_ERROR);
      }
      if (!StringUtils.hasText(result.sourceText())) {
        throw failure(
            "Search result at index " + i + " is missing sourceText",
            ErrorKind.CONFIGURATION_ERROR);
      }
    }
  }
}
