package com.codeexplain.backend.explain.provider.local;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Starts operating system processes; replaced by stubs in tests. */
@FunctionalInterface
public interface ProcessLauncher {

  Process start(List<String> command, Path workingDirectory) throws IOException;

  static ProcessLauncher system() {
    return (command, workingDirectory) -> {
      ProcessBuilder builder = new ProcessBuilder(command);
      if (workingDirectory != null) {
        builder.directory(workingDirectory.toFile());
      }
      return builder.start();
    };
  }
}
