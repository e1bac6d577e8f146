package com.codeexplain.backend.explain.health;

import com.codeexplain.backend.explain.manager.BackendHealth;
import com.codeexplain.backend.explain.manager.BackendResilienceManager;
import com.codeexplain.backend.explain.metrics.ErrorMessageSanitizer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reports UP while at least one explanation backend is healthy. Does not probe by itself. */
@Component
public class ExplanationBackendsHealthIndicator implements HealthIndicator {

  private final BackendResilienceManager manager;

  public ExplanationBackendsHealthIndicator(BackendResilienceManager manager) {
    this.manager = manager;
  }

  @Override
  public Health health() {
    Map<String, BackendHealth> snapshot = manager.healthSnapshot();
    Map<String, Object> backendDetails = new LinkedHashMap<>();
    long healthy = 0;
    for (Map.Entry<String, BackendHealth> entry : snapshot.entrySet()) {
      BackendHealth health = entry.getValue();
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("state", health.state());
      details.put("consecutiveFailures", health.consecutiveFailures());
      if (health.lastCheckedAt() != null) {
        details.put("lastCheckedAt", health.lastCheckedAt().toString());
      }
      if (health.lastResponseTimeMs() != null) {
        details.put("lastResponseTimeMs", health.lastResponseTimeMs());
      }
      if (health.lastError() != null) {
        details.put("lastError", ErrorMessageSanitizer.sanitize(health.lastError()));
      }
      backendDetails.put(entry.getKey(), details);
      if (health.healthy()) {
        healthy++;
      }
    }

    Health.Builder builder = healthy > 0 ? Health.up() : Health.down();
    return builder
        .withDetail("healthyBackends", healthy)
        .withDetail("backends", backendDetails)
        .build();
  }
}
