package io.intellixity.relata.schema;

import io.intellixity.relata.RelataException;

/**
 * Raised when a schema declaration is malformed: unknown columns or relations,
 * incompatible association column types, missing primary keys, or unreadable JSON.
 */
public final class SchemaValidationException extends RelataException {
  public SchemaValidationException(String message) {
    super(message);
  }

  public SchemaValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
