package com.codeexplain.backend.explain.service;

import com.codeexplain.backend.explain.manager.BackendHealth;
import com.codeexplain.backend.explain.manager.BackendResilienceManager;
import com.codeexplain.backend.explain.manager.ManagerStats;
import com.codeexplain.backend.explain.metrics.ErrorMessageSanitizer;
import com.codeexplain.backend.explain.provider.ExplanationBackendException;
import com.codeexplain.backend.explain.provider.model.BackendDescriptor;
import com.codeexplain.backend.explain.provider.model.ExplainOptions;
import com.codeexplain.backend.explain.provider.model.ExplanationResult;
import com.codeexplain.backend.explain.provider.model.SearchResult;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/** Entry point for callers that want a result object instead of exceptions. */
public class ExplanationService {

  private static final Logger log = LoggerFactory.getLogger(ExplanationService.class);

  static final String UNKNOWN_MODEL = "unknown";

  private final BackendResilienceManager manager;

  public ExplanationService(BackendResilienceManager manager) {
    this.manager = Objects.requireNonNull(manager, "manager");
  }

  public ExplanationResult explain(
      String query, List<SearchResult> results, ExplainOptions options) {
    try {
      return manager.explain(query, results, options);
    } catch (ExplanationBackendException ex) {
      log.warn("Explanation failed: {}", ErrorMessageSanitizer.sanitize(ex.getMessage()));
      String model =
          options != null && StringUtils.hasText(options.model()) ? options.model() : UNKNOWN_MODEL;
      return ExplanationResult.failure(model, ex.getMessage());
    }
  }

  public ManagerStats stats() {
    return manager.stats();
  }

  public List<BackendDescriptor> backends() {
    return manager.describeBackends();
  }

  public Map<String, BackendHealth> checkHealth(String backend) {
    if (StringUtils.hasText(backend)) {
      BackendHealth health = manager.checkHealth(backend);
      return health != null ? Map.of(backend, health) : Map.of();
    }
    manager.checkHealth();
    return manager.healthSnapshot();
  }
}
