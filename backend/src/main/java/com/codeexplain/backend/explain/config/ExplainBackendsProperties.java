package com.codeexplain.backend.explain.config;

import com.codeexplain.backend.explain.manager.SelectionStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.explain")
public class ExplainBackendsProperties {

  @NotBlank private String primaryBackend = "local";

  private List<String> fallbackBackends = new ArrayList<>(List.of("external"));

  @NotNull private SelectionStrategy selectionStrategy = SelectionStrategy.PRIMARY_FALLBACK;

  @NotNull private Duration healthCheckInterval = Duration.ofMinutes(1);

  @NotNull private Duration healthCheckTimeout = Duration.ofSeconds(10);

  @Min(1)
  private int maxConsecutiveFailures = 3;

  private boolean healthMonitoringEnabled = true;

  @Valid private Metrics metrics = new Metrics();

  @Valid private Map<String, Backend> backends = new LinkedHashMap<>();

  /** {@code [primary, ...fallbacks]} without blanks or duplicates, in configured order. */
  public List<String> orderedBackendNames() {
    Set<String> names = new LinkedHashSet<>();
    if (StringUtils.hasText(primaryBackend)) {
      names.add(primaryBackend.trim());
    }
    if (fallbackBackends != null) {
      fallbackBackends.stream()
          .filter(StringUtils::hasText)
          .map(String::trim)
          .forEach(names::add);
    }
    return List.copyOf(names);
  }

  public String getPrimaryBackend() {
    return primaryBackend;
  }

  public void setPrimaryBackend(String primaryBackend) {
    this.primaryBackend = primaryBackend;
  }

  public List<String> getFallbackBackends() {
    return fallbackBackends;
  }

  public void setFallbackBackends(List<String> fallbackBackends) {
    this.fallbackBackends = fallbackBackends;
  }

  public SelectionStrategy getSelectionStrategy() {
    return selectionStrategy;
  }

  public void setSelectionStrategy(SelectionStrategy selectionStrategy) {
    this.selectionStrategy = selectionStrategy;
  }

  public Duration getHealthCheckInterval() {
    return healthCheckInterval;
  }

  public void setHealthCheckInterval(Duration healthCheckInterval) {
    this.healthCheckInterval = healthCheckInterval;
  }

  public Duration getHealthCheckTimeout() {
    return healthCheckTimeout;
  }

  public void setHealthCheckTimeout(Duration healthCheckTimeout) {
    this.healthCheckTimeout = healthCheckTimeout;
  }

  public int getMaxConsecutiveFailures() {
    return maxConsecutiveFailures;
  }

  public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
    this.maxConsecutiveFailures = maxConsecutiveFailures;
  }

  public boolean isHealthMonitoringEnabled() {
    return healthMonitoringEnabled;
  }

  public void setHealthMonitoringEnabled(boolean healthMonitoringEnabled) {
    this.healthMonitoringEnabled = healthMonitoringEnabled;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public void setMetrics(Metrics metrics) {
    this.metrics = metrics;
  }

  public Map<String, Backend> getBackends() {
    return backends;
  }

  public void setBackends(Map<String, Backend> backends) {
    this.backends = backends;
  }

  public static class Metrics {

    @Min(1)
    private int maxStoredRequests = 10_000;

    @NotNull private Duration retention = Duration.ofHours(24);

    @NotNull private Duration summaryInterval = Duration.ofMinutes(5);

    public int getMaxStoredRequests() {
      return maxStoredRequests;
    }

    public void setMaxStoredRequests(int maxStoredRequests) {
      this.maxStoredRequests = maxStoredRequests;
    }

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }

    public Duration getSummaryInterval() {
      return summaryInterval;
    }

    public void setSummaryInterval(Duration summaryInterval) {
      this.summaryInterval = summaryInterval;
    }
  }

  public static class Backend {

    private BackendVariant variant;

    private Duration timeout = Duration.ofSeconds(30);

    private int maxRetries = 3;

    private Duration retryDelay = Duration.ofSeconds(1);

    @Valid private Local local;

    @Valid private External external;

    public BackendVariant getVariant() {
      return variant;
    }

    public void setVariant(BackendVariant variant) {
      this.variant = variant;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getRetryDelay() {
      return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
    }

    public Local getLocal() {
      return local;
    }

    public void setLocal(Local local) {
      this.local = local;
    }

    public External getExternal() {
      return external;
    }

    public void setExternal(External external) {
      this.external = external;
    }
  }

  public static class Local {

    private String modelName = "Qwen/Qwen2.5-Coder-1.5B-Instruct";

    private int maxResults = 8;

    private List<String> command = new ArrayList<>(List.of("python3", "llm_rag.py"));

    private String workingDirectory;

    private String interpreter = "python3";

    private List<String> requiredModules =
        new ArrayList<>(List.of("transformers", "torch", "accelerate"));

    private Duration dependencyCheckTimeout = Duration.ofSeconds(10);

    public String getModelName() {
      return modelName;
    }

    public void setModelName(String modelName) {
      this.modelName = modelName;
    }

    public int getMaxResults() {
      return maxResults;
    }

    public void setMaxResults(int maxResults) {
      this.maxResults = maxResults;
    }

    public List<String> getCommand() {
      return command;
    }

    public void setCommand(List<String> command) {
      this.command = command;
    }

    public String getWorkingDirectory() {
      return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
      this.workingDirectory = workingDirectory;
    }

    public String getInterpreter() {
      return interpreter;
    }

    public void setInterpreter(String interpreter) {
      this.interpreter = interpreter;
    }

    public List<String> getRequiredModules() {
      return requiredModules;
    }

    public void setRequiredModules(List<String> requiredModules) {
      this.requiredModules = requiredModules;
    }

    public Duration getDependencyCheckTimeout() {
      return dependencyCheckTimeout;
    }

    public void setDependencyCheckTimeout(Duration dependencyCheckTimeout) {
      this.dependencyCheckTimeout = dependencyCheckTimeout;
    }
  }

  public static class External {

    private String apiUrl = "https://api.openai.com";

    private String apiKey;

    private String model = "gpt-4o-mini";

    private Integer maxTokens;

    private Double temperature;

    public String getApiUrl() {
      return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
      this.apiUrl = apiUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public Integer getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
      this.maxTokens = maxTokens;
    }

    public Double getTemperature() {
      return temperature;
    }

    public void setTemperature(Double temperature) {
      this.temperature = temperature;
    }
  }
}
