package com.codeexplain.backend.explain.provider;

import com.codeexplain.backend.explain.config.BackendVariant;
import com.codeexplain.backend.explain.config.ExplainBackendsProperties;
import com.codeexplain.backend.explain.provider.external.ExternalApiExplanationBackend;
import com.codeexplain.backend.explain.provider.local.LocalProcessExplanationBackend;
import com.codeexplain.backend.explain.provider.local.ProcessLauncher;
import com.codeexplain.backend.explain.retry.RetryEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

public class ExplanationBackendFactory {

  private static final Logger log = LoggerFactory.getLogger(ExplanationBackendFactory.class);

  private final RetryEngine retryEngine;
  private final WebClient.Builder webClientBuilder;
  private final ObjectMapper objectMapper;
  private final ProcessLauncher processLauncher;

  public ExplanationBackendFactory(
      RetryEngine retryEngine,
      WebClient.Builder webClientBuilder,
      ObjectMapper objectMapper,
      ProcessLauncher processLauncher) {
    this.retryEngine = Objects.requireNonNull(retryEngine, "retryEngine");
    this.webClientBuilder = Objects.requireNonNull(webClientBuilder, "webClientBuilder");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.processLauncher = Objects.requireNonNull(processLauncher, "processLauncher");
  }

  public static Set<BackendVariant> supportedVariants() {
    return EnumSet.allOf(BackendVariant.class);
  }

  /**
   * Validates the settings, builds the backend and runs its configuration check once. A backend
   * that cannot be reached is still returned; it simply reports itself unavailable.
   */
  public ExplanationBackend create(String name, ExplainBackendsProperties.Backend settings) {
    validate(name, settings);
    ExplanationBackend backend =
        switch (settings.getVariant()) {
          case LOCAL ->
              new LocalProcessExplanationBackend(
                  name, settings, retryEngine, processLauncher, objectMapper);
          case EXTERNAL ->
              new ExternalApiExplanationBackend(
                  name, settings, retryEngine, webClientBuilder, objectMapper);
        };
    backend.validateConfiguration();
    if (!backend.isAvailable()) {
      log.warn("Backend '{}' ({}) created but is not available", name, settings.getVariant().id());
    } else {
      log.info("Backend '{}' ({}) created", name, settings.getVariant().id());
    }
    return backend;
  }

  /** Checks the shape of the settings without touching the network or spawning processes. */
  public void validate(String name, ExplainBackendsProperties.Backend settings) {
    if (!StringUtils.hasText(name)) {
      throw configurationError(name, "Backend name is required");
    }
    if (settings == null) {
      throw configurationError(name, "Configuration for backend '" + name + "' is missing");
    }
    BackendVariant variant = settings.getVariant();
    if (variant == null || !supportedVariants().contains(variant)) {
      throw configurationError(name, "Unsupported backend type for '" + name + "': " + variant);
    }
    Duration timeout = settings.getTimeout();
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw configurationError(name, "Timeout must be a positive duration");
    }
    if (settings.getMaxRetries() < 0) {
      throw configurationError(name, "Max retries must be a non-negative number");
    }
    if (settings.getRetryDelay() == null || settings.getRetryDelay().isNegative()) {
      throw configurationError(name, "Retry delay must be a non-negative duration");
    }
    switch (variant) {
      case LOCAL -> validateLocal(name, settings);
      case EXTERNAL -> validateExternal(name, settings);
    }
  }

  private void validateLocal(String name, ExplainBackendsProperties.Backend settings) {
    if (settings.getExternal() != null) {
      throw configurationError(name, "Local backend must not carry external API settings");
    }
    ExplainBackendsProperties.Local local = settings.getLocal();
    if (local == null) {
      throw configurationError(name, "Local backend settings are required");
    }
    if (!StringUtils.hasText(local.getModelName())) {
      throw configurationError(name, "Local model name must be a non-empty string");
    }
    if (local.getMaxResults() <= 0) {
      throw configurationError(name, "Max results must be a positive number");
    }
  }

  private void validateExternal(String name, ExplainBackendsProperties.Backend settings) {
    if (settings.getLocal() != null) {
      throw configurationError(name, "External backend must not carry local runner settings");
    }
    ExplainBackendsProperties.External external = settings.getExternal();
    if (external == null) {
      throw configurationError(name, "External API settings are required");
    }
    if (!StringUtils.hasText(external.getApiUrl())) {
      throw configurationError(name, "External API URL is required");
    }
    if (!StringUtils.hasText(external.getApiKey())) {
      throw configurationError(name, "External API key is required");
    }
    if (!StringUtils.hasText(external.getModel())) {
      throw configurationError(name, "External API model is required");
    }
    String apiUrl = external.getApiUrl();
    boolean localUrl =
        apiUrl.contains("localhost") || apiUrl.contains("127.0.0.1") || apiUrl.contains("0.0.0.0");
    String apiKey = external.getApiKey();
    if (!localUrl && !(apiKey.startsWith("sk-") || apiKey.startsWith("org-"))) {
      throw configurationError(name, "Invalid API key format for " + apiUrl);
    }
    Double temperature = external.getTemperature();
    if (temperature != null && (temperature < 0 || temperature > 2)) {
      throw configurationError(name, "Temperature must be between 0 and 2");
    }
    if (external.getMaxTokens() != null && external.getMaxTokens() <= 0) {
      throw configurationError(name, "Max tokens must be a positive number");
    }
  }

  private static ExplanationBackendException configurationError(String name, String message) {
    return new ExplanationBackendException(message, ErrorKind.CONFIGURATION_ERROR, name);
  }
}
