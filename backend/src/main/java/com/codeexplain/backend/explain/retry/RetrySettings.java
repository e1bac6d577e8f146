package com.codeexplain.backend.explain.retry;

import com.codeexplain.backend.explain.provider.ErrorKind;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

public record RetrySettings(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double backoffMultiplier,
    boolean jitter,
    Set<ErrorKind> retryableKinds) {

  static final long MAX_DELAY_CEILING_MS = 60_000L;
  static final int MAX_DELAY_FACTOR = 16;
  static final double DEFAULT_MULTIPLIER = 2.0;

  public RetrySettings {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (baseDelayMs < 0 || maxDelayMs < 0) {
      throw new IllegalArgumentException("Retry delays must not be negative");
    }
    if (backoffMultiplier < 1.0) {
      throw new IllegalArgumentException("backoffMultiplier must be >= 1");
    }
    retryableKinds =
        retryableKinds == null || retryableKinds.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(retryableKinds));
  }

  /** Defaults used by every backend: exponential x2 with jitter, capped at 16x or one minute. */
  public static RetrySettings forBackend(int maxRetries, Duration retryDelay) {
    long base = retryDelay == null ? 0L : Math.max(0L, retryDelay.toMillis());
    long maxDelay = Math.min(base * MAX_DELAY_FACTOR, MAX_DELAY_CEILING_MS);
    return new RetrySettings(
        Math.max(0, maxRetries) + 1,
        base,
        maxDelay,
        DEFAULT_MULTIPLIER,
        true,
        ErrorKind.defaultRetryable());
  }

  public boolean isRetryable(ErrorKind kind) {
    return kind != null && retryableKinds.contains(kind);
  }
}
