package com.ospicorp.anomalydetection.training;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.io.IOException;
import java.util.List;

public record TrainRequest(
    @JsonDeserialize(contentUsing = UnixTimestampDeserializer.class) List<Long> timestamps,
    List<Double> values) {

  /**
   * Binds only integral JSON numbers. Fractions, booleans, strings and nested structures bind
   * as {@code null} so validation reports them instead of Jackson coercing them to a long.
   */
  public static class UnixTimestampDeserializer extends JsonDeserializer<Long> {

    @Override
    public Long deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode node = p.getCodec().readTree(p);
      if (node != null && node.isIntegralNumber() && node.canConvertToLong()) {
        return node.longValue();
      }
      return null;
    }
  }
}
