package com.codeexplain.backend.explain.provider.external;

import com.codeexplain.backend.explain.provider.model.SearchResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/** Builds the system prompt and the user message sent to the chat completion endpoint. */
class ExplanationPromptBuilder {

  static final int MAX_CONTEXT_LENGTH = 8000;
  static final int SAFETY_BUFFER = 100;
  static final int MIN_TRUNCATED_SPACE = 200;
  static final String TRUNCATION_MARKER = "\n... [truncated]";
  static final String BLOCK_SEPARATOR = "\n\n";

  enum PromptTemplate {
    DEFAULT(
        """
        You are an expert software engineer helping developers understand code. Given a question \
        and a set of relevant code snippets, explain clearly what the code does, how the pieces \
        relate to each other and how they answer the question. Reference files by path when it \
        helps and keep the explanation concise and technically accurate."""),
    DEBUGGING(
        """
        You are an expert debugger. Given a question about a problem and a set of relevant code \
        snippets, identify likely causes of the error or bug, point at the specific code involved \
        and suggest concrete fixes. Be precise and reference files by path."""),
    ARCHITECTURE(
        """
        You are a software architect. Given a question and a set of relevant code snippets, \
        describe the structure and design of the code: components, responsibilities, patterns in \
        use and how data flows between them. Reference files by path where useful.""");

    private final String systemPrompt;

    PromptTemplate(String systemPrompt) {
      this.systemPrompt = systemPrompt;
    }

    String systemPrompt() {
      return systemPrompt;
    }
  }

  PromptTemplate selectTemplate(String query) {
    String normalized = query == null ? "" : query.toLowerCase(Locale.ROOT);
    if (containsAny(normalized, "debug", "error", "bug")) {
      return PromptTemplate.DEBUGGING;
    }
    if (containsAny(normalized, "architecture", "design", "pattern")) {
      return PromptTemplate.ARCHITECTURE;
    }
    return PromptTemplate.DEFAULT;
  }

  String systemPrompt(String query) {
    return selectTemplate(query).systemPrompt();
  }

  String userMessage(String query, List<SearchResult> results) {
    return "Query: "
        + query
        + "\n\nRelevant code snippets:\n\n"
        + buildContext(results)
        + "\n\nExplain the code above in relation to the query.";
  }

  String buildContext(List<SearchResult> results) {
    List<SearchResult> ordered = new ArrayList<>(results);
    ordered.sort(Comparator.comparingDouble(SearchResult::similarity).reversed());

    StringBuilder context = new StringBuilder();
    for (SearchResult result : ordered) {
      String separator = context.length() == 0 ? "" : BLOCK_SEPARATOR;
      String block = formatResult(result);
      if (context.length() + separator.length() + block.length() <= MAX_CONTEXT_LENGTH) {
        context.append(separator).append(block);
        continue;
      }
      int remaining =
          MAX_CONTEXT_LENGTH - context.length() - separator.length() - SAFETY_BUFFER;
      if (remaining > MIN_TRUNCATED_SPACE) {
        context.append(separator).append(truncateResult(result, remaining));
      }
      break;
    }
    return context.toString();
  }

  String formatResult(SearchResult result) {
    return formatBlock(result, result.sourceText().trim());
  }

  /** Formats the result with its source shortened so the whole block fits in {@code maxLength}. */
  String truncateResult(SearchResult result, int maxLength) {
    String source = result.sourceText().trim();
    int overhead = formatBlock(result, "").length() + TRUNCATION_MARKER.length();
    int available = Math.max(0, maxLength - overhead);
    if (source.length() <= available) {
      return formatBlock(result, source);
    }
    return formatBlock(result, source.substring(0, available) + TRUNCATION_MARKER);
  }

  private String formatBlock(SearchResult result, String source) {
    return "File: "
        + result.filePath()
        + "\nType: "
        + result.nodeType()
        + "\nSimilarity: "
        + String.format(Locale.ROOT, "%.1f", result.similarity() * 100)
        + "%\n\n```\n"
        + source
        + "\n```";
  }

  private static boolean containsAny(String text, String... keywords) {
    for (String keyword : keywords) {
      if (text.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
