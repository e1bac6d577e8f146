package com.codeexplain.backend.explain.provider.local;

import com.codeexplain.backend.explain.provider.model.SearchResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Payload written to the runner's stdin. */
record LocalRunnerRequest(
    String query,
    @JsonProperty("search_results") List<Snippet> searchResults,
    String model,
    long timeout) {

  record Snippet(
      @JsonProperty("file_path") String filePath,
      @JsonProperty("node_type") String nodeType,
      double similarity,
      @JsonProperty("source_text") String sourceText) {

    static Snippet from(SearchResult result) {
      return new Snippet(
          result.filePath(), result.nodeType(), result.similarity(), result.sourceText());
    }
  }
}
