package com.codeexplain.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeExplainApplication {

  public static void main(String[] args) {
    SpringApplication.run(CodeExplainApplication.class, args);
  }
}
