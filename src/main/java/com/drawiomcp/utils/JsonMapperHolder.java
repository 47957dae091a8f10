package com.drawiomcp.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Holder for the shared ObjectMapper used by tool responses and the MCP transport.
 */
public final class JsonMapperHolder {

  private static final ObjectMapper INSTANCE = createMapper();

  private JsonMapperHolder() {}

  private static ObjectMapper createMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.getFactory().configure(JsonWriteFeature.ESCAPE_NON_ASCII.mappedFeature(), true);
    mapper.registerModule(new Jdk8Module());
    return mapper;
  }

  public static ObjectMapper getMapper() {
    return INSTANCE;
  }

  /**
   * Serializes an object to a JSON string.
   *
   * @throws JsonProcessingException if serialization fails
   */
  public static String toJson(Object obj) throws JsonProcessingException {
    return INSTANCE.writeValueAsString(obj);
  }
}
