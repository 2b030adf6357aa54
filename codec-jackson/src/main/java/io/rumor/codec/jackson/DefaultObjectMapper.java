package io.rumor.codec.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

final class DefaultObjectMapper {

  static final ObjectMapper OBJECT_MAPPER = newObjectMapper();

  private DefaultObjectMapper() {
    // Do not instantiate
  }

  private static ObjectMapper newObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    // numbers are broadcast values, keep their equality stable across nodes
    mapper.configure(DeserializationFeature.USE_LONG_FOR_INTS, true);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
    mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    // stdout must stay open after every frame
    mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    return mapper;
  }
}
