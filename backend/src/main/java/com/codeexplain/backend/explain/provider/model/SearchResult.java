package com.codeexplain.backend.explain.provider.model;

public record SearchResult(String filePath, String nodeType, double similarity, String sourceText) {}
