package com.flamingo.ai.factextraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FactExtractionApplication {

  public static void main(String[] args) {
    SpringApplication.run(FactExtractionApplication.class, args);
  }
}
