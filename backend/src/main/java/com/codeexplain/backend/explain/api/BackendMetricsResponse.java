package com.codeexplain.backend.explain.api;

import com.codeexplain.backend.explain.metrics.BackendAggregate;
import com.codeexplain.backend.explain.metrics.BackendComparison;
import com.codeexplain.backend.explain.metrics.RequestMetric;
import com.codeexplain.backend.explain.provider.ErrorKind;
import java.util.List;
import java.util.Map;

public record BackendMetricsResponse(
    BackendComparison comparison,
    Map<String, BackendAggregate> aggregates,
    Map<ErrorKind, Long> failurePatterns,
    List<RequestMetric> recentRequests) {}
