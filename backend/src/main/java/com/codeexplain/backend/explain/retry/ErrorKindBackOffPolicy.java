package com.codeexplain.backend.explain.retry;

import com.codeexplain.backend.explain.metrics.ErrorMessageSanitizer;
import com.codeexplain.backend.explain.provider.ErrorKind;
import com.codeexplain.backend.explain.provider.ExplanationBackendException;
import java.time.Clock;
import java.time.Instant;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Back-off that waits according to {@link RetryEngine#computeDelay} and records every scheduled
 * retry in the owning {@link CallContext}.
 */
class ErrorKindBackOffPolicy implements BackOffPolicy {

  private static final Logger log = LoggerFactory.getLogger(ErrorKindBackOffPolicy.class);

  private final CallContext callContext;
  private final String operationName;
  private final Sleeper sleeper;
  private final Clock clock;
  private final DoubleSupplier random;

  ErrorKindBackOffPolicy(
      CallContext callContext,
      String operationName,
      Sleeper sleeper,
      Clock clock,
      DoubleSupplier random) {
    this.callContext = callContext;
    this.operationName = operationName;
    this.sleeper = sleeper;
    this.clock = clock;
    this.random = random;
  }

  @Override
  public BackOffContext start(RetryContext context) {
    return new AttemptContext(context);
  }

  @Override
  public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
    RetryContext retryContext = ((AttemptContext) backOffContext).retryContext;
    int failedAttempt = retryContext.getRetryCount();
    Throwable lastError = retryContext.getLastThrowable();
    Instant now = clock.instant();

    if (lastError instanceof ExplanationBackendException backendError
        && backendError.kind() == ErrorKind.RATE_LIMIT_ERROR) {
      callContext.updateRateLimitHint(
          backendError.retryAfter().orElse(now.plus(RetryEngine.DEFAULT_RATE_LIMIT_WINDOW)));
    }

    long delayMs =
        RetryEngine.computeDelay(
            failedAttempt,
            callContext.retrySettings(),
            callContext.rateLimitHint(),
            now,
            random.getAsDouble());
    String message =
        lastError != null ? ErrorMessageSanitizer.sanitize(lastError.getMessage()) : "unknown error";
    callContext.recordRetry(new RetryAttempt(failedAttempt, message, delayMs, now));

    log.info(
        "Retrying {} for request {} (attempt {}/{}) after {}ms: {}",
        operationName,
        callContext.requestId(),
        failedAttempt + 1,
        callContext.retrySettings().maxAttempts(),
        delayMs,
        message);

    if (delayMs <= 0) {
      return;
    }
    try {
      sleeper.sleep(delayMs);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new BackOffInterruptedException("Retry back off interrupted", ex);
    }
  }

  private static final class AttemptContext implements BackOffContext {

    private final transient RetryContext retryContext;

    private AttemptContext(RetryContext retryContext) {
      this.retryContext = retryContext;
    }
  }
}
