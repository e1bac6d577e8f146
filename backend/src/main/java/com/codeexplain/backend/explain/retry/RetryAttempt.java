package com.codeexplain.backend.explain.retry;

import java.time.Instant;

/** One scheduled retry: the attempt that failed, why, and how long we waited before the next. */
public record RetryAttempt(int attempt, String error, long delayMs, Instant at) {}
