package com.flamingo.ai.assessrec;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the assessment recommendation service. */
@SpringBootApplication
public class AssessmentRecommenderApplication {

  public static void main(String[] args) {
    SpringApplication.run(AssessmentRecommenderApplication.class, args);
  }
}
