package com.codeexplain.backend.explain.provider.model;

import java.time.Duration;

/** Per-request overrides; {@code null} components fall back to the backend configuration. */
public record ExplainOptions(String model, Integer maxTokens, Duration timeout, Integer maxResults) {

  private static final ExplainOptions DEFAULTS = new ExplainOptions(null, null, null, null);

  public static ExplainOptions defaults() {
    return DEFAULTS;
  }
}
