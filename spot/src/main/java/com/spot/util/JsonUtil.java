package com.spot.util;

import com.fasterxml.jackson.core.JsonParser.Feature;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.afterburner.AfterburnerModule;
import java.util.List;
import java.util.Map;

/** Shared Jackson mapper for record input. */
public class JsonUtil {
  private static final TypeReference<List<Map<String, Object>>> RECORDS_TYPE =
      new TypeReference<>() {};

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .addModule(new AfterburnerModule())
          .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
          .configure(Feature.ALLOW_UNQUOTED_CONTROL_CHARS, true)
          .build();

  private JsonUtil() {}

  /**
   * Parses a JSON array of objects. Integral numbers stay integers and the rest become doubles;
   * null array elements are returned as is. A null literal input yields null.
   */
  public static List<Map<String, Object>> readRecords(String json) throws JsonProcessingException {
    return MAPPER.readValue(json, RECORDS_TYPE);
  }
}
