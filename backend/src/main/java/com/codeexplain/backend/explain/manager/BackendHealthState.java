package com.codeexplain.backend.explain.manager;

public enum BackendHealthState {
  UNKNOWN,
  HEALTHY,
  UNHEALTHY
}
