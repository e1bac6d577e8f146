package com.codeexplain.backend.explain.provider;

import com.codeexplain.backend.explain.provider.model.BackendDescriptor;
import com.codeexplain.backend.explain.provider.model.ExplainOptions;
import com.codeexplain.backend.explain.provider.model.ExplanationResult;
import com.codeexplain.backend.explain.provider.model.SearchResult;
import java.util.List;

public interface ExplanationBackend {

  String name();

  /**
   * Produces an explanation for the query over the given snippets.
   *
   * @throws ExplanationBackendException when the backend cannot produce one
   * @throws ExplanationCancelledException when the calling thread is interrupted
   */
  ExplanationResult generate(String query, List<SearchResult> results, ExplainOptions options);

  /**
   * Validates the settings and probes availability once. An unreachable backend still validates;
   * it just stays unavailable.
   *
   * @throws ExplanationBackendException with {@link ErrorKind#CONFIGURATION_ERROR} on bad settings
   */
  boolean validateConfiguration();

  /** {@code false} until {@link #validateConfiguration()} succeeded and again after cleanup. */
  boolean isAvailable();

  /** Re-runs only the availability probe. */
  boolean refreshAvailability();

  BackendDescriptor describe();

  /** Releases resources. Never throws. */
  void cleanup();
}
