package com.triage.analysis.model;

import java.time.Instant;
import java.util.Map;

/**
 * A discrete event recorded against an incident (deploy, feature flag flip, config push...).
 * <p>
 * {@code ts} may be null; such events never take part in correlation. {@code meta} is carried
 * through to the ranked output untouched.
 */
public record EventRecord(
    String id,
    String eventType,
    Instant ts,
    Map<String, Object> meta
) {}
