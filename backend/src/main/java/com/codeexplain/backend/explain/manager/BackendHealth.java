package com.codeexplain.backend.explain.manager;

import com.codeexplain.backend.explain.metrics.ErrorMessageSanitizer;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Immutable health snapshot; the manager replaces it on every transition. Stored errors are
 * sanitized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackendHealth(
    BackendHealthState state,
    Instant lastCheckedAt,
    int consecutiveFailures,
    String lastError,
    Long lastResponseTimeMs) {

  public static BackendHealth unknown(Instant now) {
    return new BackendHealth(BackendHealthState.UNKNOWN, now, 0, null, null);
  }

  static BackendHealth initial(Instant now, boolean available) {
    return new BackendHealth(
        available ? BackendHealthState.HEALTHY : BackendHealthState.UNHEALTHY,
        now,
        0,
        available ? null : "Backend not available after validation",
        null);
  }

  static BackendHealth creationFailed(Instant now, String error, int maxConsecutiveFailures) {
    return new BackendHealth(
        BackendHealthState.UNHEALTHY,
        now,
        maxConsecutiveFailures,
        ErrorMessageSanitizer.sanitize(error),
        null);
  }

  public boolean healthy() {
    return state == BackendHealthState.HEALTHY;
  }

  BackendHealth recordSuccess(Instant now, Long responseTimeMs) {
    return new BackendHealth(
        BackendHealthState.HEALTHY,
        now,
        0,
        null,
        responseTimeMs != null ? responseTimeMs : lastResponseTimeMs);
  }

  BackendHealth recordFailure(Instant now, String error, int maxConsecutiveFailures) {
    int failures = consecutiveFailures + 1;
    BackendHealthState next =
        failures >= maxConsecutiveFailures ? BackendHealthState.UNHEALTHY : state;
    return new BackendHealth(
        next, now, failures, ErrorMessageSanitizer.sanitize(error), lastResponseTimeMs);
  }
}
