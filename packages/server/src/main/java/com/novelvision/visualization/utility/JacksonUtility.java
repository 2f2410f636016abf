package com.novelvision.visualization.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.novelvision.visualization.exception.VisualizationErrorCode;
import com.novelvision.visualization.exception.VisualizationException;

/** Shared, pre-configured Jackson mappers. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER = baseMapper();
  private static final ObjectMapper SNAKE_CASE_MAPPER =
      baseMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

  private JacksonUtility() {}

  private static ObjectMapper baseMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);
  }

  /** Mapper with Java property names (camelCase). */
  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /** Mapper for remote APIs that speak snake_case. */
  public static ObjectMapper getSnakeCaseMapper() {
    return SNAKE_CASE_MAPPER;
  }

  public static String toJson(Object value) {
    try {
      return JSON_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new VisualizationException(
          VisualizationErrorCode.UNKNOWN, "Could not serialize value to JSON", e);
    }
  }
}
