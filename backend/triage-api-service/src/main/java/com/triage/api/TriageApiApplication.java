package com.triage.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TriageApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(TriageApiApplication.class, args);
  }
}
