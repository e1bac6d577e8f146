package com.codeexplain.backend.explain.provider.local;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
record LocalRunnerResponse(
    boolean success, String explanation, String error, String model, String device) {}
