package io.intellixity.lingua.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinguaExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(LinguaExamplesApplication.class, args);
  }
}
