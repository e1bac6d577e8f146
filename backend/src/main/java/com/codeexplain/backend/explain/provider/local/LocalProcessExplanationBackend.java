package com.codeexplain.backend.explain.provider.local;

import com.codeexplain.backend.explain.config.ExplainBackendsProperties;
import com.codeexplain.backend.explain.provider.AbstractExplanationBackend;
import com.codeexplain.backend.explain.provider.ErrorKind;
import com.codeexplain.backend.explain.provider.model.ExplainOptions;
import com.codeexplain.backend.explain.provider.model.ExplanationResult;
import com.codeexplain.backend.explain.provider.model.SearchResult;
import com.codeexplain.backend.explain.retry.CallContext;
import com.codeexplain.backend.explain.retry.RetryEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Backend that spawns a local model runner per request. The runner reads a JSON payload from
 * stdin and answers with a single JSON document on stdout.
 */
public class LocalProcessExplanationBackend extends AbstractExplanationBackend {

  public static final String TYPE = "local";

  static final String DEFAULT_MODEL = "Qwen/Qwen2.5-Coder-1.5B-Instruct";
  static final int DEFAULT_MAX_RESULTS = 8;

  private final ExplainBackendsProperties.Local local;
  private final ObjectMapper objectMapper;
  private final ProcessRunner processRunner;
  private final LocalRuntimeProbe runtimeProbe;

  public LocalProcessExplanationBackend(
      String name,
      ExplainBackendsProperties.Backend settings,
      RetryEngine retryEngine,
      ProcessLauncher processLauncher,
      ObjectMapper objectMapper) {
    super(name, settings, retryEngine);
    this.local = Objects.requireNonNull(settings.getLocal(), "local settings");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.processRunner = new ProcessRunner(processLauncher);
    this.runtimeProbe = new LocalRuntimeProbe(processRunner);
  }

  /** Maps a runner failure message to an error kind; first matching rule wins. */
  static ErrorKind categorize(String message) {
    String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
    if (text.contains("timeout") || text.contains("timed out")) {
      return ErrorKind.NETWORK_ERROR;
    }
    if (text.contains("dependency") || text.contains("not available")) {
      return ErrorKind.BACKEND_UNAVAILABLE;
    }
    if (text.contains("parse") || text.contains("format")) {
      return ErrorKind.RESPONSE_FORMAT_ERROR;
    }
    if (text.contains("config")) {
      return ErrorKind.CONFIGURATION_ERROR;
    }
    return ErrorKind.NETWORK_ERROR;
  }

  @Override
  protected ExplanationResult doGenerate(
      String query, List<SearchResult> results, ExplainOptions options) {
    String model = StringUtils.hasText(options.model()) ? options.model() : modelName();
    int maxResults =
        options.maxResults() != null && options.maxResults() > 0
            ? options.maxResults()
            : local.getMaxResults() > 0 ? local.getMaxResults() : DEFAULT_MAX_RESULTS;
    Duration timeout = effectiveTimeout(options);
    CallContext context = newCallContext(query, results.size());

    LocalRunnerRequest request =
        new LocalRunnerRequest(
            query,
            results.stream().limit(maxResults).map(LocalRunnerRequest.Snippet::from).toList(),
            model,
            timeout.toMillis());

    LocalRunnerResponse response =
        retryEngine.execute(context, "local runner", () -> runOnce(request, timeout));

    if (!response.success()) {
      String error =
          StringUtils.hasText(response.error())
              ? response.error()
              : "Local runner reported failure without an error message";
      throw failure("Local runner failed: " + error, categorize(error));
    }
    if (!StringUtils.hasText(response.explanation())) {
      throw failure(
          "Local runner returned an empty explanation", ErrorKind.RESPONSE_FORMAT_ERROR);
    }
    if (StringUtils.hasText(response.device())) {
      log.debug("Request {} served by local runner on {}", context.requestId(), response.device());
    }
    String answeredModel = StringUtils.hasText(response.model()) ? response.model() : model;
    return ExplanationResult.success(response.explanation().trim(), answeredModel, null, null, null);
  }

  private LocalRunnerResponse runOnce(LocalRunnerRequest request, Duration timeout) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(request) + "\n";
    } catch (JsonProcessingException ex) {
      throw failure("Failed to serialize local runner payload", ErrorKind.CONFIGURATION_ERROR, ex);
    }

    ProcessOutcome outcome;
    try {
      outcome = processRunner.run(local.getCommand(), workingDirectory(), payload, timeout);
    } catch (ProcessRunner.ProcessTimeoutException ex) {
      throw failure("Local runner timed out after " + timeout.toMillis() + "ms", ErrorKind.NETWORK_ERROR, ex);
    } catch (IOException ex) {
      String message = "Local runner not available: " + ex.getMessage();
      throw failure(message, ErrorKind.BACKEND_UNAVAILABLE, ex);
    }

    if (outcome.exitCode() != 0) {
      String detail = StringUtils.hasText(outcome.stderr()) ? outcome.stderr().trim() : "no output";
      String message = "Local runner exited with code " + outcome.exitCode() + ": " + detail;
      throw failure(message, categorize(detail));
    }
    try {
      return objectMapper.readValue(outcome.stdout(), LocalRunnerResponse.class);
    } catch (JsonProcessingException ex) {
      throw failure(
          "Failed to parse local runner response: " + ex.getOriginalMessage(),
          ErrorKind.RESPONSE_FORMAT_ERROR,
          ex);
    }
  }

  @Override
  protected void validateBackendSettings() {
    if (!StringUtils.hasText(local.getModelName())) {
      throw failure("Local model name must be a non-empty string", ErrorKind.CONFIGURATION_ERROR);
    }
    if (local.getMaxResults() <= 0) {
      throw failure("Max results must be a positive number", ErrorKind.CONFIGURATION_ERROR);
    }
    if (local.getCommand() == null
        || local.getCommand().isEmpty()
        || !StringUtils.hasText(local.getCommand().get(0))) {
      throw failure("Local runner command is required", ErrorKind.CONFIGURATION_ERROR);
    }
  }

  @Override
  protected void probeAvailability() {
    String interpreter =
        StringUtils.hasText(local.getInterpreter()) ? local.getInterpreter() : local.getCommand().get(0);
    String missing =
        runtimeProbe.findMissingDependency(
            interpreter,
            local.getRequiredModules(),
            workingDirectory(),
            local.getDependencyCheckTimeout() != null
                ? local.getDependencyCheckTimeout()
                : Duration.ofSeconds(10));
    if (missing != null) {
      throw failure("Local runtime dependency " + missing, ErrorKind.BACKEND_UNAVAILABLE);
    }
  }

  private String modelName() {
    return StringUtils.hasText(local.getModelName()) ? local.getModelName() : DEFAULT_MODEL;
  }

  private Path workingDirectory() {
    return StringUtils.hasText(local.getWorkingDirectory())
        ? Path.of(local.getWorkingDirectory())
        : null;
  }

  @Override
  protected String type() {
    return TYPE;
  }

  @Override
  protected String description() {
    return "Local model runner process";
  }

  @Override
  protected Map<String, Object> describeConfiguration() {
    Map<String, Object> configuration = new LinkedHashMap<>();
    configuration.put("model", modelName());
    configuration.put("maxResults", local.getMaxResults());
    configuration.put("command", local.getCommand());
    configuration.put("requiredModules", local.getRequiredModules());
    configuration.put(
        "timeoutMs", settings.getTimeout() != null ? settings.getTimeout().toMillis() : null);
    configuration.put("maxRetries", settings.getMaxRetries());
    return configuration;
  }

  @Override
  protected List<String> capabilities() {
    return List.of("code-explanation", "offline");
  }
}
