package com.telelink.scoring.dto;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.Locale;

/**
 * Reads plan flags sent either as JSON booleans or as the front end's "yes"/"no" strings.
 * Anything else is rejected rather than guessed.
 */
public class YesNoBooleanDeserializer extends StdDeserializer<Boolean> {

  public YesNoBooleanDeserializer() {
    super(Boolean.class);
  }

  @Override
  public Boolean deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonToken t = p.currentToken();
    if (t == JsonToken.VALUE_TRUE) return Boolean.TRUE;
    if (t == JsonToken.VALUE_FALSE) return Boolean.FALSE;
    if (t == JsonToken.VALUE_STRING) {
      String text = p.getText().trim().toLowerCase(Locale.ROOT);
      switch (text) {
        case "yes":
        case "true":
          return Boolean.TRUE;
        case "no":
        case "false":
          return Boolean.FALSE;
        default:
          return (Boolean) ctxt.handleWeirdStringValue(Boolean.class, p.getText(), "expected yes/no");
      }
    }
    return (Boolean) ctxt.handleUnexpectedToken(Boolean.class, p);
  }
}
