package io.intellixity.relata.schema;

import java.util.Locale;

/** Scalar type tags for columns. Tags in the same {@link Domain} may be compared in join conditions. */
public enum ColumnType {
  INTEGER(Domain.NUMERIC, "int", "integer"),
  BIGINT(Domain.NUMERIC, "long", "bigint"),
  NUMERIC(Domain.NUMERIC, "numeric", "decimal"),
  VARCHAR(Domain.TEXT, "string", "varchar"),
  TEXT(Domain.TEXT, "text"),
  BOOLEAN(Domain.BOOLEAN, "boolean", "bool"),
  DATE(Domain.TEMPORAL, "date"),
  TIMESTAMP(Domain.TEMPORAL, "timestamp"),
  UUID(Domain.UUID, "uuid");

  public enum Domain { NUMERIC, TEXT, BOOLEAN, TEMPORAL, UUID }

  private final Domain domain;
  private final String[] ids;

  ColumnType(Domain domain, String... ids) {
    this.domain = domain;
    this.ids = ids;
  }

  public Domain domain() { return domain; }

  /** Canonical id, as written in schema JSON. */
  public String id() { return ids[0]; }

  public boolean comparableWith(ColumnType other) {
    return other != null && other.domain() == domain();
  }

  public static ColumnType fromId(String id) {
    if (id == null || id.isBlank()) throw new SchemaValidationException("column type is blank");
    String s = id.trim().toLowerCase(Locale.ROOT);
    for (ColumnType t : values()) {
      for (String candidate : t.ids) {
        if (candidate.equals(s)) return t;
      }
    }
    throw new SchemaValidationException("Unknown column type: " + id);
  }
}
