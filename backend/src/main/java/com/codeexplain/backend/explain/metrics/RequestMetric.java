package com.codeexplain.backend.explain.metrics;

import com.codeexplain.backend.explain.provider.ErrorKind;
import com.codeexplain.backend.explain.provider.model.TokenUsage;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestMetric(
    String requestId,
    String backendName,
    Instant timestamp,
    int queryLength,
    int resultCount,
    long responseTimeMs,
    boolean success,
    ErrorKind errorKind,
    String errorMessage,
    String model,
    Integer explanationLength,
    TokenUsage tokenUsage) {

  public static RequestMetric success(
      String requestId,
      String backendName,
      Instant timestamp,
      int queryLength,
      int resultCount,
      long responseTimeMs,
      String model,
      Integer explanationLength,
      TokenUsage tokenUsage) {
    return new RequestMetric(
        requestId,
        backendName,
        timestamp,
        queryLength,
        resultCount,
        responseTimeMs,
        true,
        null,
        null,
        model,
        explanationLength,
        tokenUsage);
  }

  public static RequestMetric failure(
      String requestId,
      String backendName,
      Instant timestamp,
      int queryLength,
      int resultCount,
      long responseTimeMs,
      ErrorKind errorKind,
      String errorMessage) {
    return new RequestMetric(
        requestId,
        backendName,
        timestamp,
        queryLength,
        resultCount,
        responseTimeMs,
        false,
        errorKind,
        errorMessage,
        null,
        null,
        null);
  }

  RequestMetric withErrorMessage(String message) {
    return new RequestMetric(
        requestId,
        backendName,
        timestamp,
        queryLength,
        resultCount,
        responseTimeMs,
        success,
        errorKind,
        message,
        model,
        explanationLength,
        tokenUsage);
  }
}
