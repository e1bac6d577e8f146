package com.codeexplain.backend.explain.provider.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeexplain.backend.explain.config.ExplainBackendsProperties;
import com.codeexplain.backend.explain.provider.ErrorKind;
import com.codeexplain.backend.explain.provider.ExplanationBackendException;
import com.codeexplain.backend.explain.provider.model.ExplainOptions;
import com.codeexplain.backend.explain.provider.model.ExplanationResult;
import com.codeexplain.backend.explain.provider.model.SearchResult;
import com.codeexplain.backend.explain.retry.RetryEngine;
import com.codeexplain.backend.explain.support.StubProcess;
import com.codeexplain.backend.explain.support.TestBackendSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LocalProcessExplanationBackendTest {

  private static final String ANSWER =
      "{\"success\":true,\"explanation\":\"  It retries.  \",\"model\":\"qwen-local\",\"device\":\"cpu\"}";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final Deque<Object> processes = new ArrayDeque<>();
  private final List<List<String>> commands = new ArrayList<>();
  private final List<Long> sleeps = new ArrayList<>();
  private RetryEngine retryEngine;

  @BeforeEach
  void setUp() {
    retryEngine =
        new RetryEngine(
            sleeps::add, Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC), () -> 0.0);
  }

  @Test
  void probeChecksInterpreterAndEachModule() {
    LocalProcessExplanationBackend backend = backend(TestBackendSettings.local(0));
    queueHealthyRuntime();

    assertThat(backend.validateConfiguration()).isTrue();

    assertThat(backend.isAvailable()).isTrue();
    assertThat(commands)
        .containsExactly(
            List.of("python3", "--version"),
            List.of("python3", "-c", "import transformers"),
            List.of("python3", "-c", "import torch"));
  }

  @Test
  void missingModuleLeavesBackendUnavailable() {
    LocalProcessExplanationBackend backend = backend(TestBackendSettings.local(0));
    processes.add(StubProcess.succeeding("Python 3.11.4"));
    processes.add(StubProcess.exiting(1, "", "ModuleNotFoundError: No module named 'transformers'"));

    assertThat(backend.validateConfiguration()).isTrue();

    assertThat(backend.isAvailable()).isFalse();
    assertThat(commands).hasSize(2);
    assertThatThrownBy(() -> backend.generate("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
  }

  @Test
  void missingInterpreterLeavesBackendUnavailable() {
    LocalProcessExplanationBackend backend = backend(TestBackendSettings.local(0));
    processes.add(new IOException("No such file or directory"));

    backend.validateConfiguration();

    assertThat(backend.isAvailable()).isFalse();
    assertThat(commands).containsExactly(List.of("python3", "--version"));
  }

  @Test
  void blankModelNameIsAConfigurationError() {
    ExplainBackendsProperties.Backend settings = TestBackendSettings.local(0);
    settings.getLocal().setModelName(" ");
    LocalProcessExplanationBackend backend = backend(settings);

    assertThatThrownBy(backend::validateConfiguration)
        .isInstanceOf(ExplanationBackendException.class)
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.CONFIGURATION_ERROR);
    assertThat(commands).isEmpty();
  }

  @Test
  void writesPayloadToStdinAndParsesAnswer() throws Exception {
    LocalProcessExplanationBackend backend = availableBackend(TestBackendSettings.local(0));
    StubProcess runner = StubProcess.succeeding(ANSWER);
    processes.add(runner);

    ExplanationResult result =
        backend.generate("How does retry work?", TestBackendSettings.sampleResults(), null);

    assertThat(result.success()).isTrue();
    assertThat(result.explanation()).isEqualTo("It retries.");
    assertThat(result.model()).isEqualTo("qwen-local");
    assertThat(commands.get(commands.size() - 1)).containsExactly("python3", "runner.py");

    JsonNode payload = objectMapper.readTree(runner.stdinContent());
    assertThat(payload.path("query").asText()).isEqualTo("How does retry work?");
    assertThat(payload.path("model").asText()).isEqualTo("test-model");
    assertThat(payload.path("timeout").asLong()).isEqualTo(5000);
    assertThat(payload.path("search_results")).hasSize(2);
    assertThat(payload.path("search_results").get(0).path("file_path").asText())
        .isEqualTo("src/retry.ts");
    assertThat(payload.path("search_results").get(0).path("source_text").asText())
        .startsWith("function retry()");
  }

  @Test
  void limitsSnippetsToMaxResults() throws Exception {
    LocalProcessExplanationBackend backend = availableBackend(TestBackendSettings.local(0));
    StubProcess runner = StubProcess.succeeding(ANSWER);
    processes.add(runner);
    List<SearchResult> results =
        IntStream.range(0, 12)
            .mapToObj(i -> new SearchResult("f" + i + ".ts", "function", 0.5, "code" + i))
            .toList();

    backend.generate("q", results, new ExplainOptions("other-model", null, null, 3));

    JsonNode payload = objectMapper.readTree(runner.stdinContent());
    assertThat(payload.path("search_results")).hasSize(3);
    assertThat(payload.path("model").asText()).isEqualTo("other-model");
  }

  @Test
  void hangingRunnerIsKilledAndReportedAsTimeout() {
    LocalProcessExplanationBackend backend = availableBackend(TestBackendSettings.local(0));
    StubProcess runner = StubProcess.hanging();
    processes.add(runner);

    assertThatThrownBy(() -> backend.generate("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .hasMessage("Local runner timed out after 5000ms")
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.NETWORK_ERROR);
    assertThat(runner.destroyed()).isTrue();
  }

  @Test
  void dependencyFailureOnStderrIsRetriedThenReported() {
    LocalProcessExplanationBackend backend = availableBackend(TestBackendSettings.local(1));
    processes.add(StubProcess.exiting(1, "", "Missing dependency: torch"));
    processes.add(StubProcess.exiting(1, "", "Missing dependency: torch"));

    assertThatThrownBy(() -> backend.generate("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .hasMessageContaining("exited with code 1")
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
    assertThat(sleeps).hasSize(1);
  }

  @Test
  void unparseableOutputIsNotRetried() {
    LocalProcessExplanationBackend backend = availableBackend(TestBackendSettings.local(3));
    processes.add(StubProcess.succeeding("Loading model...\nnot json"));

    assertThatThrownBy(() -> backend.generate("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.RESPONSE_FORMAT_ERROR);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void runnerReportedFailureIsCategorizedWithoutRetry() {
    LocalProcessExplanationBackend backend = availableBackend(TestBackendSettings.local(3));
    processes.add(
        StubProcess.succeeding("{\"success\":false,\"error\":\"Invalid config: model path\"}"));

    assertThatThrownBy(() -> backend.generate("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .hasMessage("Local runner failed: Invalid config: model path")
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.CONFIGURATION_ERROR);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void emptyExplanationIsAResponseFormatError() {
    LocalProcessExplanationBackend backend = availableBackend(TestBackendSettings.local(0));
    processes.add(StubProcess.succeeding("{\"success\":true,\"explanation\":\"\"}"));

    assertThatThrownBy(() -> backend.generate("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.RESPONSE_FORMAT_ERROR);
  }

  @Test
  void launchFailureMeansRunnerUnavailable() {
    LocalProcessExplanationBackend backend = availableBackend(TestBackendSettings.local(0));
    processes.add(new IOException("Cannot run program \"python3\""));

    assertThatThrownBy(() -> backend.generate("q", TestBackendSettings.sampleResults(), null))
        .isInstanceOf(ExplanationBackendException.class)
        .hasMessageStartingWith("Local runner not available")
        .extracting(ex -> ((ExplanationBackendException) ex).kind())
        .isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "Model load timeout | NETWORK_ERROR",
        "request timed out | NETWORK_ERROR",
        "Dependency torch missing | BACKEND_UNAVAILABLE",
        "CUDA not available | BACKEND_UNAVAILABLE",
        "Could not parse input | RESPONSE_FORMAT_ERROR",
        "bad output format | RESPONSE_FORMAT_ERROR",
        "Config file missing | CONFIGURATION_ERROR",
        "segmentation fault | NETWORK_ERROR"
      })
  void categorizesRunnerMessages(String message, ErrorKind expected) {
    assertThat(LocalProcessExplanationBackend.categorize(message)).isEqualTo(expected);
  }

  @Test
  void cleanupMarksBackendUnavailable() {
    LocalProcessExplanationBackend backend = availableBackend(TestBackendSettings.local(0));

    backend.cleanup();

    assertThat(backend.isAvailable()).isFalse();
    assertThat(backend.describe().configuration()).containsEntry("model", "test-model");
  }

  private LocalProcessExplanationBackend availableBackend(
      ExplainBackendsProperties.Backend settings) {
    LocalProcessExplanationBackend backend = backend(settings);
    queueHealthyRuntime();
    backend.validateConfiguration();
    assertThat(backend.isAvailable()).isTrue();
    return backend;
  }

  private void queueHealthyRuntime() {
    processes.add(StubProcess.succeeding("Python 3.11.4"));
    processes.add(StubProcess.succeeding(""));
    processes.add(StubProcess.succeeding(""));
  }

  private LocalProcessExplanationBackend backend(ExplainBackendsProperties.Backend settings) {
    ProcessLauncher launcher =
        (command, workingDirectory) -> {
          commands.add(List.copyOf(command));
          Object next = processes.removeFirst();
          if (next instanceof IOException ex) {
            throw ex;
          }
          return (StubProcess) next;
        };
    return new LocalProcessExplanationBackend("local", settings, retryEngine, launcher, objectMapper);
  }
}
