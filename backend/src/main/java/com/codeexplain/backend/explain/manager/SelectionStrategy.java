package com.codeexplain.backend.explain.manager;

import java.util.Arrays;
import java.util.Locale;

public enum SelectionStrategy {
  PRIMARY_FALLBACK("primary-fallback"),
  FASTEST_FIRST("fastest-first"),
  ROUND_ROBIN("round-robin");

  private final String id;

  SelectionStrategy(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static SelectionStrategy fromId(String value) {
    if (value == null) {
      return PRIMARY_FALLBACK;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(strategy -> strategy.id.equals(normalized) || strategy.name().equalsIgnoreCase(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown selection strategy: " + value));
  }
}
