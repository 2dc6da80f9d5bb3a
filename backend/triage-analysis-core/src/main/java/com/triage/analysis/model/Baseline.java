package com.triage.analysis.model;

/** Frozen statistics over the leading window of one metric stream. */
public record Baseline(int size, double mean, double std) {}
