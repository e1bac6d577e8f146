package com.codeexplain.backend.explain.provider.local;

import com.codeexplain.backend.explain.metrics.ErrorMessageSanitizer;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Checks that the interpreter and the runner's modules are installed. Never installs anything. */
class LocalRuntimeProbe {

  private static final Logger log = LoggerFactory.getLogger(LocalRuntimeProbe.class);

  private final ProcessRunner runner;

  LocalRuntimeProbe(ProcessRunner runner) {
    this.runner = runner;
  }

  /** Returns {@code null} when everything is present, otherwise a description of what is missing. */
  String findMissingDependency(
      String interpreter, List<String> requiredModules, Path workingDirectory, Duration timeout) {
    if (!succeeds(List.of(interpreter, "--version"), workingDirectory, timeout)) {
      return "interpreter '" + interpreter + "' not available";
    }
    for (String module : requiredModules == null ? List.<String>of() : requiredModules) {
      if (!succeeds(List.of(interpreter, "-c", "import " + module), workingDirectory, timeout)) {
        return "module '" + module + "' not available";
      }
    }
    return null;
  }

  private boolean succeeds(List<String> command, Path workingDirectory, Duration timeout) {
    try {
      ProcessOutcome outcome = runner.run(command, workingDirectory, null, timeout);
      if (outcome.exitCode() != 0) {
        log.debug(
            "Dependency check {} exited with {}: {}",
            command,
            outcome.exitCode(),
            ErrorMessageSanitizer.sanitize(outcome.stderr()));
        return false;
      }
      return true;
    } catch (IOException | ProcessRunner.ProcessTimeoutException ex) {
      log.debug(
          "Dependency check {} failed: {}", command, ErrorMessageSanitizer.sanitize(ex.getMessage()));
      return false;
    }
  }
}
