package stagequeue.optimizer.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import stagequeue.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}, for applications that
 * already configure one.
 */
public final class JacksonJsonCodec implements JsonCodec {
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonJsonCodec() {
    this(new ObjectMapper());
  }

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String toJson(Map<String, ?> details) {
    if (details == null) {
      return null;
    }
    try {
      return mapper.writeValueAsString(details);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode details: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.strip())) {
      return new LinkedHashMap<>();
    }
    try {
      LinkedHashMap<String, Object> parsed = mapper.readValue(json, MAP_TYPE);
      return parsed != null ? parsed : new LinkedHashMap<>();
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Not a JSON object: " + e.getOriginalMessage(), e);
    }
  }
}
