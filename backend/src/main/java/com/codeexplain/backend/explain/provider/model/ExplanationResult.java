package com.codeexplain.backend.explain.provider.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.util.StringUtils;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExplanationResult(
    boolean success,
    String explanation,
    String model,
    String backendName,
    TokenUsage usage,
    String responseId,
    String finishReason,
    String error,
    Long responseTimeMs) {

  public ExplanationResult {
    if (success && !StringUtils.hasText(explanation)) {
      throw new IllegalArgumentException("Successful result requires a non-empty explanation");
    }
    if (!success && !StringUtils.hasText(error)) {
      throw new IllegalArgumentException("Failed result requires a non-empty error message");
    }
  }

  public static ExplanationResult success(
      String explanation,
      String model,
      TokenUsage usage,
      String responseId,
      String finishReason) {
    return new ExplanationResult(
        true, explanation, model, null, usage, responseId, finishReason, null, null);
  }

  public static ExplanationResult failure(String model, String error) {
    return new ExplanationResult(false, null, model, null, null, null, null, error, null);
  }

  public ExplanationResult withBackend(String backendName, long responseTimeMs) {
    return new ExplanationResult(
        success,
        explanation,
        model,
        backendName,
        usage,
        responseId,
        finishReason,
        error,
        responseTimeMs);
  }
}
