package com.example.authclient.domain.entity;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Reads any JSON value into a {@link ClaimValue}.
 */
public class ClaimValueDeserializer extends JsonDeserializer<ClaimValue> {

  @Override
  public ClaimValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
    JsonNode node = parser.getCodec().readTree(parser);
    return ClaimValue.fromJson(node);
  }

  @Override
  public ClaimValue getNullValue(DeserializationContext context) {
    return ClaimValue.NullValue.INSTANCE;
  }
}
