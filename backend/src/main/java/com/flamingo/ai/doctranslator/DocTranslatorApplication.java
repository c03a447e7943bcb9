package com.flamingo.ai.doctranslator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for hosting the document translation core inside a Spring Boot process. */
@SpringBootApplication
public class DocTranslatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocTranslatorApplication.class, args);
  }
}
