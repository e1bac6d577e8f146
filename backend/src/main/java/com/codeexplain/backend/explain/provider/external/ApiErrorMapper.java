package com.codeexplain.backend.explain.provider.external;

import com.codeexplain.backend.explain.provider.ErrorKind;
import com.codeexplain.backend.explain.provider.ExplanationBackendException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/** Translates non-2xx chat completion responses into classified backend failures. */
class ApiErrorMapper {

  private final String backendName;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  ApiErrorMapper(String backendName, ObjectMapper objectMapper, Clock clock) {
    this.backendName = backendName;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  ExplanationBackendException toException(int status, String body, HttpHeaders headers) {
    Instant retryAfter = parseRetryAfter(headers);
    JsonNode error = parseErrorNode(body);
    if (error != null) {
      String type = error.path("type").asText("");
      if (!StringUtils.hasText(type)) {
        type = error.path("code").asText("");
      }
      String message = error.path("message").asText("");
      String param = error.path("param").asText("");
      ErrorKind kind = kindForType(type);
      if (kind == null) {
        kind = kindForStatus(status);
      }
      return new ExplanationBackendException(
          describe(type, message, param, status), kind, backendName, null, retryAfter);
    }
    String text = StringUtils.hasText(body) ? body.trim() : "no response body";
    return new ExplanationBackendException(
        "External API request failed with status " + status + ": " + text,
        kindForStatus(status),
        backendName,
        null,
        retryAfter);
  }

  static ErrorKind kindForType(String type) {
    if (!StringUtils.hasText(type)) {
      return null;
    }
    return switch (type) {
      case "invalid_request_error", "model_not_found" -> ErrorKind.CONFIGURATION_ERROR;
      case "authentication_error", "permission_error" -> ErrorKind.AUTHENTICATION_ERROR;
      case "rate_limit_error", "insufficient_quota" -> ErrorKind.RATE_LIMIT_ERROR;
      case "server_error", "service_unavailable" -> ErrorKind.BACKEND_UNAVAILABLE;
      default -> ErrorKind.NETWORK_ERROR;
    };
  }

  static ErrorKind kindForStatus(int status) {
    if (status == 400 || status == 404) {
      return ErrorKind.CONFIGURATION_ERROR;
    }
    if (status == 401 || status == 403) {
      return ErrorKind.AUTHENTICATION_ERROR;
    }
    if (status == 429) {
      return ErrorKind.RATE_LIMIT_ERROR;
    }
    if (status >= 500) {
      return ErrorKind.BACKEND_UNAVAILABLE;
    }
    return ErrorKind.NETWORK_ERROR;
  }

  private static String describe(String type, String message, String param, int status) {
    String detail = StringUtils.hasText(message) ? message : "status " + status;
    String prefix =
        switch (type) {
          case "authentication_error" -> "External API authentication failed";
          case "permission_error" -> "External API permission denied";
          case "rate_limit_error" -> "External API rate limit exceeded";
          case "insufficient_quota" -> "External API quota exceeded";
          case "model_not_found" -> "External API model not found";
          case "invalid_request_error" -> "External API rejected the request";
          case "server_error", "service_unavailable" -> "External API service error";
          default -> "External API error";
        };
    String text = prefix + ": " + detail;
    return StringUtils.hasText(param) ? text + " (parameter: " + param + ")" : text;
  }

  private JsonNode parseErrorNode(String body) {
    if (!StringUtils.hasText(body)) {
      return null;
    }
    try {
      JsonNode root = objectMapper.readTree(body);
      JsonNode error = root.path("error");
      return error.isObject() ? error : null;
    } catch (JsonProcessingException ex) {
      return null;
    }
  }

  private Instant parseRetryAfter(HttpHeaders headers) {
    if (headers == null) {
      return null;
    }
    String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      long seconds = Long.parseLong(value.trim());
      return seconds >= 0 ? clock.instant().plusSeconds(seconds) : null;
    } catch (NumberFormatException ex) {
      // HTTP-date form is not used by chat completion APIs; fall back to the default window.
      return null;
    }
  }
}
