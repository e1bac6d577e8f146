package com.codeexplain.backend.explain.controller;

import com.codeexplain.backend.explain.api.BackendMetricsResponse;
import com.codeexplain.backend.explain.api.BackendsStatusResponse;
import com.codeexplain.backend.explain.api.ExplainRequest;
import com.codeexplain.backend.explain.manager.BackendHealth;
import com.codeexplain.backend.explain.manager.ManagerStats;
import com.codeexplain.backend.explain.metrics.BackendAggregate;
import com.codeexplain.backend.explain.metrics.BackendMetricsCollector;
import com.codeexplain.backend.explain.provider.model.ExplainOptions;
import com.codeexplain.backend.explain.provider.model.ExplanationResult;
import com.codeexplain.backend.explain.provider.model.SearchResult;
import com.codeexplain.backend.explain.service.ExplanationService;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/explain")
public class ExplainController {

  private final ExplanationService explanationService;
  private final BackendMetricsCollector metricsCollector;

  public ExplainController(
      ExplanationService explanationService, BackendMetricsCollector metricsCollector) {
    this.explanationService = explanationService;
    this.metricsCollector = metricsCollector;
  }

  @PostMapping
  public ResponseEntity<ExplanationResult> explain(@Valid @RequestBody ExplainRequest request) {
    List<SearchResult> results =
        request.results().stream()
            .map(
                snippet ->
                    new SearchResult(
                        snippet.filePath(),
                        snippet.nodeType(),
                        snippet.similarity(),
                        snippet.sourceText()))
            .toList();
    ExplanationResult result =
        explanationService.explain(request.query(), results, toOptions(request.options()));
    return result.success()
        ? ResponseEntity.ok(result)
        : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
  }

  @GetMapping("/backends")
  public BackendsStatusResponse backends() {
    ManagerStats stats = explanationService.stats();
    return new BackendsStatusResponse(
        stats.strategy() != null ? stats.strategy().id() : null,
        stats.primaryBackend(),
        stats.fallbackBackends(),
        stats.healthyBackends(),
        stats.health(),
        explanationService.backends());
  }

  @PostMapping("/backends/health-check")
  public Map<String, BackendHealth> healthCheck(
      @RequestParam(name = "backend", required = false) String backend) {
    try {
      return explanationService.checkHealth(backend);
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
    }
  }

  @GetMapping("/metrics")
  public BackendMetricsResponse metrics(
      @RequestParam(name = "backend", required = false) String backend,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    String filter = StringUtils.hasText(backend) ? backend : null;
    Map<String, BackendAggregate> aggregates = metricsCollector.aggregates();
    if (filter != null) {
      BackendAggregate aggregate = metricsCollector.aggregate(filter);
      aggregates = aggregate != null ? Map.of(filter, aggregate) : Map.of();
    }
    return new BackendMetricsResponse(
        metricsCollector.compare(),
        aggregates,
        metricsCollector.failurePatterns(filter),
        metricsCollector.recentRequests(filter, Math.max(0, limit)));
  }

  private static ExplainOptions toOptions(ExplainRequest.Options options) {
    if (options == null) {
      return ExplainOptions.defaults();
    }
    return new ExplainOptions(
        options.model(),
        options.maxTokens(),
        options.timeoutMs() != null ? Duration.ofMillis(options.timeoutMs()) : null,
        options.maxResults());
  }
}
