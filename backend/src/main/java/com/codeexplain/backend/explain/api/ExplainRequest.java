package com.codeexplain.backend.explain.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

@Schema(description = "Request for a natural-language explanation of code search results.")
public record ExplainRequest(
    @Schema(
            description = "Question about the code.",
            example = "How does the retry back off work?",
            requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String query,
    @Schema(description = "Code snippets returned by the search, best match first or in any order.")
        @NotNull
        List<@Valid Snippet> results,
    @Schema(description = "Optional request overrides.") @Valid Options options) {

  public record Snippet(
      @Schema(description = "Path of the file the snippet comes from.") @NotBlank String filePath,
      @Schema(description = "Kind of syntax node, e.g. function or class.") String nodeType,
      @Schema(description = "Similarity score in [0, 1].")
          @DecimalMin("0.0")
          @DecimalMax("1.0")
          double similarity,
      @Schema(description = "Source text of the snippet.") @NotBlank String sourceText) {}

  public record Options(
      @Schema(description = "Model override.") String model,
      @Schema(description = "Maximum tokens to generate.") @Positive Integer maxTokens,
      @Schema(description = "Per-call timeout in milliseconds.") @Positive Long timeoutMs,
      @Schema(description = "Maximum number of snippets passed to the local runner.") @Positive
          Integer maxResults) {}
}
