package io.b2mash.payables.audit;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Map;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/** Stores audit details as JSON text so the column works on both PostgreSQL and H2. */
@Converter
public class DetailsJsonConverter implements AttributeConverter<Map<String, Object>, String> {

  private static final ObjectMapper MAPPER = JsonMapper.builder().build();
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(Map<String, Object> attribute) {
    return attribute == null ? null : MAPPER.writeValueAsString(attribute);
  }

  @Override
  public Map<String, Object> convertToEntityAttribute(String dbData) {
    return dbData == null ? null : MAPPER.readValue(dbData, MAP_TYPE);
  }
}
