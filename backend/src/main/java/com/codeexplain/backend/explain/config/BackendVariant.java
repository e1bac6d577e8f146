package com.codeexplain.backend.explain.config;

public enum BackendVariant {
  LOCAL("local"),
  EXTERNAL("external");

  private final String id;

  BackendVariant(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }
}
