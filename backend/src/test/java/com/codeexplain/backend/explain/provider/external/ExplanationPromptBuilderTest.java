package com.codeexplain.backend.explain.provider.external;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeexplain.backend.explain.provider.external.ExplanationPromptBuilder.PromptTemplate;
import com.codeexplain.backend.explain.provider.model.SearchResult;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ExplanationPromptBuilderTest {

  private final ExplanationPromptBuilder builder = new ExplanationPromptBuilder();

  @ParameterizedTest
  @CsvSource({
    "Why does this throw an Error?, DEBUGGING",
    "how to debug the parser, DEBUGGING",
    "Explain the architecture of the cache, ARCHITECTURE",
    "Which design pattern is used?, ARCHITECTURE",
    "Design a fix for this bug, DEBUGGING",
    "What does this function do?, DEFAULT"
  })
  void selectsTemplateByKeyword(String query, PromptTemplate expected) {
    assertThat(builder.selectTemplate(query)).isEqualTo(expected);
  }

  @Test
  void ordersResultsBySimilarityAndFormatsThem() {
    List<SearchResult> results =
        List.of(
            new SearchResult("low.ts", "function", 0.41, "low()"),
            new SearchResult("high.ts", "class", 0.875, "  high()  "));

    String context = builder.buildContext(results);

    assertThat(context.indexOf("File: high.ts")).isLessThan(context.indexOf("File: low.ts"));
    assertThat(context)
        .startsWith("File: high.ts\nType: class\nSimilarity: 87.5%\n\n```\nhigh()\n```")
        .contains("```\n\nFile: low.ts");
  }

  @Test
  void truncatesOverflowingEntryWhenEnoughSpaceRemains() {
    List<SearchResult> results =
        List.of(
            new SearchResult("first.ts", "function", 0.9, "a".repeat(7_000)),
            new SearchResult("second.ts", "function", 0.8, "b".repeat(3_000)),
            new SearchResult("third.ts", "function", 0.7, "c".repeat(10)));

    String context = builder.buildContext(results);

    assertThat(context).contains("File: second.ts").contains(ExplanationPromptBuilder.TRUNCATION_MARKER);
    assertThat(context).doesNotContain("third.ts");
    assertThat(context.length()).isLessThanOrEqualTo(ExplanationPromptBuilder.MAX_CONTEXT_LENGTH);
  }

  @Test
  void omitsOverflowingEntryWhenTooLittleSpaceRemains() {
    List<SearchResult> results =
        List.of(
            new SearchResult("first.ts", "function", 0.9, "a".repeat(7_800)),
            new SearchResult("second.ts", "function", 0.8, "b".repeat(500)));

    String context = builder.buildContext(results);

    assertThat(context).contains("File: first.ts").doesNotContain("second.ts");
    assertThat(context).doesNotContain(ExplanationPromptBuilder.TRUNCATION_MARKER);
  }

  @Test
  void contextStaysWithinBudgetForManyResults() {
    List<SearchResult> results =
        IntStream.range(0, 40)
            .mapToObj(i -> new SearchResult("file" + i + ".ts", "function", i / 40.0, "x".repeat(450)))
            .toList();

    String context = builder.buildContext(results);

    assertThat(context.length())
        .isLessThanOrEqualTo(
            ExplanationPromptBuilder.MAX_CONTEXT_LENGTH
                + ExplanationPromptBuilder.TRUNCATION_MARKER.length());
    assertThat(context).startsWith("File: file39.ts");
  }

  @Test
  void userMessageStartsWithQuery() {
    String message =
        builder.userMessage(
            "What is this?", List.of(new SearchResult("a.ts", "function", 0.5, "code()")));

    assertThat(message).startsWith("Query: What is this?").contains("File: a.ts");
  }
}
