package com.codeexplain.backend.explain.provider;

import java.util.EnumSet;
import java.util.Set;

/** Closed vocabulary of backend failures used for retry, health and metrics decisions. */
public enum ErrorKind {
  CONFIGURATION_ERROR,
  NETWORK_ERROR,
  AUTHENTICATION_ERROR,
  RATE_LIMIT_ERROR,
  BACKEND_UNAVAILABLE,
  RESPONSE_FORMAT_ERROR;

  private static final Set<ErrorKind> DEFAULT_RETRYABLE =
      EnumSet.of(NETWORK_ERROR, RATE_LIMIT_ERROR, BACKEND_UNAVAILABLE);

  public static Set<ErrorKind> defaultRetryable() {
    return EnumSet.copyOf(DEFAULT_RETRYABLE);
  }

  public boolean retryableByDefault() {
    return DEFAULT_RETRYABLE.contains(this);
  }
}
