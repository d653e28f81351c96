package com.agri.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Общий потокобезопасный {@link ObjectMapper} приложения.
 * <p>
 * Поля сериализуются в snake_case (probe_id, command_type), даты — в ISO-8601.
 */
public final class JsonMapper {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  public static ObjectMapper get() {
    return MAPPER;
  }

  private JsonMapper() {
    throw new UnsupportedOperationException("Utility class");
  }
}
