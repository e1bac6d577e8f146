package com.codeexplain.backend.explain.retry;

import com.codeexplain.backend.explain.metrics.ErrorMessageSanitizer;
import com.codeexplain.backend.explain.provider.ErrorKind;
import com.codeexplain.backend.explain.provider.ExplanationBackendException;
import com.codeexplain.backend.explain.provider.ExplanationCancelledException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

/**
 * Runs a backend operation with bounded exponential back-off. Failures are classified by {@link
 * ErrorKind}: only retryable kinds are attempted again, everything else is rethrown at once.
 */
public class RetryEngine {

  private static final Logger log = LoggerFactory.getLogger(RetryEngine.class);

  static final Duration DEFAULT_RATE_LIMIT_WINDOW = Duration.ofMinutes(1);
  static final long RATE_LIMIT_BUFFER_MS = 1_000L;
  static final double JITTER_RATIO = 0.1;

  private final Sleeper sleeper;
  private final Clock clock;
  private final DoubleSupplier random;

  public RetryEngine() {
    this(new ThreadWaitSleeper(), Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
  }

  public RetryEngine(Sleeper sleeper, Clock clock, DoubleSupplier random) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
  }

  public Clock clock() {
    return clock;
  }

  /**
   * Delay before the given retry (1 = first retry): {@code base * multiplier^retryNumber}.
   *
   * @param randomFraction value in {@code [0, 1)} used for jitter
   */
  public static long computeDelay(
      int retryNumber,
      RetrySettings settings,
      RateLimitHint hint,
      Instant now,
      double randomFraction) {
    int exponent = Math.max(0, retryNumber);
    double delay = settings.baseDelayMs() * Math.pow(settings.backoffMultiplier(), exponent);
    delay = Math.min(delay, settings.maxDelayMs());

    if (settings.jitter()) {
      double fraction = Math.min(Math.max(randomFraction, 0.0), 1.0);
      delay = Math.min(delay + delay * JITTER_RATIO * fraction, settings.maxDelayMs());
    }

    if (hint != null && hint.resetAt() != null && now != null) {
      long untilReset = Duration.between(now, hint.resetAt()).toMillis();
      if (untilReset > 0 && untilReset < delay * 2) {
        delay = Math.max(delay, untilReset + RATE_LIMIT_BUFFER_MS);
      }
    }
    return Math.round(delay);
  }

  public <T> T execute(CallContext context, String operationName, Supplier<T> operation) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(operation, "operation");
    RetrySettings settings = context.retrySettings();

    RetryTemplate template =
        RetryTemplate.builder()
            .maxAttempts(settings.maxAttempts())
            .customBackoff(
                new ErrorKindBackOffPolicy(context, operationName, sleeper, clock, random))
            .retryOn(throwable -> isRetryable(throwable, settings))
            .build();

    try {
      return template.execute(
          retryContext -> {
            if (Thread.currentThread().isInterrupted()) {
              throw new ExplanationCancelledException(
                  operationName + " cancelled before attempt " + (retryContext.getRetryCount() + 1),
                  null);
            }
            return operation.get();
          });
    } catch (BackOffInterruptedException ex) {
      throw new ExplanationCancelledException(operationName + " cancelled during back off", ex);
    } catch (ExplanationBackendException ex) {
      if (!settings.isRetryable(ex.kind())) {
        log.warn(
            "{} failed for request {} with non-retryable {}: {}",
            operationName,
            context.requestId(),
            ex.kind(),
            ErrorMessageSanitizer.sanitize(ex.getMessage()));
      } else {
        log.warn(
            "{} failed for request {} after {} attempts: {}",
            operationName,
            context.requestId(),
            context.retryHistory().size() + 1,
            ErrorMessageSanitizer.sanitize(ex.getMessage()));
      }
      throw ex;
    }
  }

  private static boolean isRetryable(Throwable throwable, RetrySettings settings) {
    if (throwable instanceof ExplanationCancelledException) {
      return false;
    }
    if (throwable instanceof ExplanationBackendException backendError) {
      return settings.isRetryable(backendError.kind());
    }
    return false;
  }
}
