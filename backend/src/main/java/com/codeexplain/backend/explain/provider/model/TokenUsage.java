package com.codeexplain.backend.explain.provider.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenUsage(Integer promptTokens, Integer completionTokens, Integer totalTokens) {

  public long totalOrZero() {
    if (totalTokens != null) {
      return totalTokens;
    }
    if (promptTokens != null && completionTokens != null) {
      return (long) promptTokens + completionTokens;
    }
    return 0L;
  }
}
