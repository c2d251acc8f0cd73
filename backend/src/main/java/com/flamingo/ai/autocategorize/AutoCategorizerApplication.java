package com.flamingo.ai.autocategorize;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the auto-categorization service. */
@SpringBootApplication
public class AutoCategorizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(AutoCategorizerApplication.class, args);
  }
}
