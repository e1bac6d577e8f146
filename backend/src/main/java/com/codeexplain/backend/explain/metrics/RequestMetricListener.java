package com.codeexplain.backend.explain.metrics;

/** Receives every sanitized request metric, e.g. to forward it to an external sink. */
@FunctionalInterface
public interface RequestMetricListener {

  void onRequest(RequestMetric metric);
}
