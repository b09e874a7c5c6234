package io.intellixity.relata.schema;

import java.util.Objects;

public record Column(
    String name,
    ColumnType type,
    boolean nullable,
    boolean unique,
    /** SQL default expression, or null when the column has none. */
    String defaultExpression
) {
  public Column {
    if (name == null || name.isBlank()) throw new SchemaValidationException("column name is blank");
    Objects.requireNonNull(type, "type");
  }

  public static Column of(String name, ColumnType type) {
    return new Column(name, type, true, false, null);
  }

  public Column notNull() { return new Column(name, type, false, unique, defaultExpression); }
  public Column asUnique() { return new Column(name, type, nullable, true, defaultExpression); }
  public Column defaultsTo(String expr) { return new Column(name, type, nullable, unique, expr); }
}
