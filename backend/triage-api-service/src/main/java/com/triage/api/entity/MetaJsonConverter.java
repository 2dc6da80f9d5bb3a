package com.triage.api.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;

/** Stores free-form metadata maps as JSON text. Key order survives the round trip. */
@Converter
public class MetaJsonConverter implements AttributeConverter<Map<String, Object>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(Map<String, Object> meta) {
    if (meta == null) return null;
    try {
      return MAPPER.writeValueAsString(meta);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize metadata", e);
    }
  }

  @Override
  public Map<String, Object> convertToEntityAttribute(String json) {
    if (json == null || json.isBlank()) return null;
    try {
      return MAPPER.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to parse stored metadata", e);
    }
  }
}
