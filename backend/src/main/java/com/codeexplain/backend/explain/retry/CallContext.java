package com.codeexplain.backend.explain.retry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * State of a single backend call. Only the retry history and the rate-limit hint change once the
 * call has started.
 */
public final class CallContext {

  static final int LOGGED_QUERY_LENGTH = 100;

  private final String requestId;
  private final Instant startTime;
  private final String query;
  private final int resultCount;
  private final RetrySettings retrySettings;
  private final List<RetryAttempt> retryHistory = new ArrayList<>();
  private volatile RateLimitHint rateLimitHint;

  private CallContext(
      String requestId, Instant startTime, String query, int resultCount, RetrySettings settings) {
    this.requestId = requestId;
    this.startTime = startTime;
    this.query = query;
    this.resultCount = resultCount;
    this.retrySettings = settings;
  }

  public static CallContext create(
      String requestIdPrefix,
      String query,
      int resultCount,
      RetrySettings settings,
      Instant now) {
    String requestId =
        requestIdPrefix + "_" + now.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
    return new CallContext(requestId, now, abbreviate(query), resultCount, settings);
  }

  private static String abbreviate(String query) {
    if (query == null) {
      return "";
    }
    return query.length() <= LOGGED_QUERY_LENGTH ? query : query.substring(0, LOGGED_QUERY_LENGTH);
  }

  public String requestId() {
    return requestId;
  }

  public Instant startTime() {
    return startTime;
  }

  /** The query shortened for logging. */
  public String query() {
    return query;
  }

  public int resultCount() {
    return resultCount;
  }

  public RetrySettings retrySettings() {
    return retrySettings;
  }

  public RateLimitHint rateLimitHint() {
    return rateLimitHint;
  }

  void updateRateLimitHint(Instant resetAt) {
    this.rateLimitHint = new RateLimitHint(resetAt);
  }

  synchronized void recordRetry(RetryAttempt attempt) {
    retryHistory.add(attempt);
  }

  public synchronized List<RetryAttempt> retryHistory() {
    return List.copyOf(retryHistory);
  }
}
