package com.codeexplain.backend.explain.metrics;

import java.util.List;
import java.util.regex.Pattern;

/** Masks credentials and token-like strings before error text reaches logs or metrics. */
public final class ErrorMessageSanitizer {

  private record Rule(Pattern pattern, String replacement) {}

  private static final List<Rule> RULES =
      List.of(
          new Rule(Pattern.compile("sk-[a-zA-Z0-9]{48}"), "sk-***REDACTED***"),
          new Rule(Pattern.compile("org-[a-zA-Z0-9]{24}"), "org-***REDACTED***"),
          new Rule(
              Pattern.compile("Bearer\\s+[a-zA-Z0-9._-]+", Pattern.CASE_INSENSITIVE),
              "Bearer ***REDACTED***"),
          new Rule(
              Pattern.compile("authorization:\\s*[^\\s,]+", Pattern.CASE_INSENSITIVE),
              "authorization: ***REDACTED***"),
          new Rule(Pattern.compile("\\b[a-zA-Z0-9]{32,}\\b"), "***REDACTED***"));

  private ErrorMessageSanitizer() {}

  public static String sanitize(String message) {
    if (message == null) {
      return null;
    }
    String sanitized = message;
    for (Rule rule : RULES) {
      sanitized = rule.pattern().matcher(sanitized).replaceAll(rule.replacement());
    }
    return sanitized;
  }
}
