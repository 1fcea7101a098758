package com.e2eq.persistence.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class JSONUtils {
   private static final JSONUtils instance = new JSONUtils();
   protected ObjectMapper mapper;
   protected ObjectWriter prettyWriter;

   private JSONUtils() {
      mapper = new ObjectMapper()
                  .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                  .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
      prettyWriter = mapper.writerWithDefaultPrettyPrinter();
   }

   public static JSONUtils instance() {
      return instance;
   }

   public ObjectMapper getMapper() {
      return mapper;
   }

   public ObjectWriter getPrettyWriter() {
      return prettyWriter;
   }

   public ObjectNode newObject() {
      return mapper.createObjectNode();
   }

   public JsonNode toTree(Object value) {
      return mapper.valueToTree(value);
   }

   public <T> T fromTree(JsonNode node, Class<T> type) throws JsonProcessingException {
      return mapper.treeToValue(node, type);
   }

   public String toJson(JsonNode node) throws JsonProcessingException {
      return mapper.writeValueAsString(node);
   }

   public JsonNode parse(String json) throws JsonProcessingException {
      return mapper.readTree(json);
   }
}
