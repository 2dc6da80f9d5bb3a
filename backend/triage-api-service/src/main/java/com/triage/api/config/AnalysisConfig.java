package com.triage.api.config;

import com.triage.analysis.engine.IncidentAnalyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisConfig {

  @Bean
  public IncidentAnalyzer incidentAnalyzer() {
    return new IncidentAnalyzer();
  }
}
