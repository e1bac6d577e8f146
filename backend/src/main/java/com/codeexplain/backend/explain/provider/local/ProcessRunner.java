package com.codeexplain.backend.explain.provider.local;

import com.codeexplain.backend.explain.provider.ExplanationCancelledException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/** Runs one child process to completion, feeding stdin and collecting both output streams. */
class ProcessRunner {

  private final ProcessLauncher launcher;

  ProcessRunner(ProcessLauncher launcher) {
    this.launcher = Objects.requireNonNull(launcher, "launcher");
  }

  /**
   * @throws IOException when the process cannot be started or its stdin cannot be written
   * @throws ProcessTimeoutException when it does not finish within {@code timeout}
   */
  ProcessOutcome run(List<String> command, Path workingDirectory, String stdin, Duration timeout)
      throws IOException {
    Process process = launcher.start(command, workingDirectory);

    StreamCollector stdout = new StreamCollector();
    StreamCollector stderr = new StreamCollector();
    Thread stdoutThread = new Thread(() -> stdout.collect(process.getInputStream()));
    Thread stderrThread = new Thread(() -> stderr.collect(process.getErrorStream()));
    stdoutThread.setDaemon(true);
    stderrThread.setDaemon(true);
    stdoutThread.start();
    stderrThread.start();

    try (OutputStream input = process.getOutputStream()) {
      if (stdin != null) {
        input.write(stdin.getBytes(StandardCharsets.UTF_8));
        input.flush();
      }
    } catch (IOException ex) {
      process.destroyForcibly();
      throw ex;
    }

    boolean finished;
    try {
      finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new ExplanationCancelledException("Local process interrupted", ex);
    }
    if (!finished) {
      process.destroyForcibly();
      throw new ProcessTimeoutException(
          "Local process timed out after " + timeout.toMillis() + "ms");
    }
    try {
      stdoutThread.join(timeout.toMillis());
      stderrThread.join(timeout.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ExplanationCancelledException("Local process interrupted", ex);
    }
    return new ProcessOutcome(process.exitValue(), stdout.content(), stderr.content());
  }

  static final class ProcessTimeoutException extends RuntimeException {
    ProcessTimeoutException(String message) {
      super(message);
    }
  }

  private static final class StreamCollector {
    private final StringBuffer buffer = new StringBuffer();

    void collect(InputStream stream) {
      try (stream) {
        byte[] data = stream.readAllBytes();
        buffer.append(new String(data, StandardCharsets.UTF_8));
      } catch (IOException ex) {
        buffer.append(ex.getMessage());
      }
    }

    String content() {
      return buffer.toString();
    }
  }
}
