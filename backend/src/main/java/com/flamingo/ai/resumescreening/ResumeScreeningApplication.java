package com.flamingo.ai.resumescreening;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the resume screening backend. */
@SpringBootApplication
public class ResumeScreeningApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResumeScreeningApplication.class, args);
  }
}
