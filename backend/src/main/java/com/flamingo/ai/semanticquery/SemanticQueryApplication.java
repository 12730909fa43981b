package com.flamingo.ai.semanticquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the semantic-query service. */
@SpringBootApplication
public class SemanticQueryApplication {

  public static void main(String[] args) {
    SpringApplication.run(SemanticQueryApplication.class, args);
  }
}
