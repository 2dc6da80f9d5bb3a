package com.triage.api.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triage.api.model.IngestRequest;
import com.triage.api.model.IngestResponse;
import com.triage.api.service.IngestService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Ingests batches published to Kafka. Each record value is an {@link IngestRequest} in the same
 * JSON shape as the HTTP endpoint accepts. Bad records are logged and counted, never retried.
 */
@Component
@Profile("kafka-ingest")
public class IngestBatchConsumer {

  private static final Logger log = LoggerFactory.getLogger(IngestBatchConsumer.class);

  private final IngestService ingest;
  private final ObjectMapper mapper;
  private final Validator validator;
  private final Counter messagesConsumed;
  private final Counter messagesFailed;

  public IngestBatchConsumer(IngestService ingest, ObjectMapper mapper, Validator validator, MeterRegistry metrics) {
    this.ingest = ingest;
    this.mapper = mapper;
    this.validator = validator;
    this.messagesConsumed = metrics.counter("triage_ingest_messages_consumed_total");
    this.messagesFailed = metrics.counter("triage_ingest_messages_failed_total");
  }

  @KafkaListener(
    topics = "${triage.kafka.topics.ingest:incident_ingest}",
    concurrency = "${triage.kafka.concurrency:1}"
  )
  public void onMessage(ConsumerRecord<String, String> record) {
    String value = record.value();
    if (value == null || value.isBlank()) {
      messagesFailed.increment();
      log.warn("Empty ingest record at partition={} offset={}", record.partition(), record.offset());
      return;
    }
    try {
      IngestRequest request = mapper.readValue(value, IngestRequest.class);
      Set<ConstraintViolation<IngestRequest>> violations = validator.validate(request);
      if (!violations.isEmpty()) {
        messagesFailed.increment();
        log.warn("Rejected ingest record at partition={} offset={}: {} violation(s), first: {} {}",
            record.partition(), record.offset(), violations.size(),
            violations.iterator().next().getPropertyPath(), violations.iterator().next().getMessage());
        return;
      }
      IngestResponse result = ingest.ingest(request);
      messagesConsumed.increment();
      log.debug("Consumed ingest record partition={} offset={} incident={} metrics={} events={}",
          record.partition(), record.offset(), result.incidentId(), result.metricsIngested(), result.eventsIngested());
    } catch (Exception ex) {
      messagesFailed.increment();
      log.warn("Failed to ingest record at partition={} offset={}: {}", record.partition(), record.offset(), ex.getMessage());
    }
  }
}
