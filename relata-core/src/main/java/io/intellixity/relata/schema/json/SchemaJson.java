package io.intellixity.relata.schema.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.schema.Schema;
import io.intellixity.relata.schema.SchemaValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/** Reads {@link Schema} declarations from JSON text or classpath resources. */
public final class SchemaJson {
  private static final ObjectMapper JSON = new ObjectMapper();

  private SchemaJson() {}

  public static Schema parse(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return JSON.readValue(json, Schema.class);
    } catch (JsonProcessingException e) {
      throw new SchemaValidationException("Malformed schema JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static Schema load(InputStream in) {
    Objects.requireNonNull(in, "in");
    try (in) {
      return JSON.readValue(in, Schema.class);
    } catch (IOException e) {
      throw new SchemaValidationException("Failed to read schema JSON", e);
    }
  }

  public static Schema loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = SchemaJson.class.getClassLoader();
    InputStream in = cl.getResourceAsStream(resource);
    if (in == null) throw new SchemaValidationException("Schema resource not found: " + resource);
    return load(in);
  }
}
