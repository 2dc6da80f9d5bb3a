package com.triage.api.controller;

import com.triage.api.model.IngestRequest;
import com.triage.api.model.IngestResponse;
import com.triage.api.service.IngestService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class IngestController {

  private final IngestService ingest;

  public IngestController(IngestService ingest) {
    this.ingest = ingest;
  }

  @PostMapping("/ingest")
  public IngestResponse ingest(@Valid @RequestBody IngestRequest request) {
    return ingest.ingest(request);
  }
}
