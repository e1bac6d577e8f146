package com.codeexplain.backend.explain.provider;

/**
 * Raised when the calling thread is interrupted while a backend attempt is in flight. Never
 * retried and never turned into a fallback.
 */
public class ExplanationCancelledException extends RuntimeException {

  public ExplanationCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
