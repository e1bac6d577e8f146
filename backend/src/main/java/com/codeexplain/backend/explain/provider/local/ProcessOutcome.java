package com.codeexplain.backend.explain.provider.local;

record ProcessOutcome(int exitCode, String stdout, String stderr) {}
