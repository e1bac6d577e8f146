package com.codeexplain.backend.explain.retry;

import java.time.Instant;

public record RateLimitHint(Instant resetAt) {}
