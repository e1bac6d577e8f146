package com.codeexplain.backend.explain.provider;

import java.time.Instant;
import java.util.Optional;

public class ExplanationBackendException extends RuntimeException {

  private final ErrorKind kind;
  private final String backendName;
  private final Instant retryAfter;

  public ExplanationBackendException(String message, ErrorKind kind, String backendName) {
    this(message, kind, backendName, null, null);
  }

  public ExplanationBackendException(
      String message, ErrorKind kind, String backendName, Throwable cause) {
    this(message, kind, backendName, cause, null);
  }

  public ExplanationBackendException(
      String message, ErrorKind kind, String backendName, Throwable cause, Instant retryAfter) {
    super(message, cause);
    this.kind = kind != null ? kind : ErrorKind.NETWORK_ERROR;
    this.backendName = backendName;
    this.retryAfter = retryAfter;
  }

  public ErrorKind kind() {
    return kind;
  }

  public String backendName() {
    return backendName;
  }

  /** Moment the remote side asked us to wait for, when it told us (e.g. {@code Retry-After}). */
  public Optional<Instant> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
