package io.intellixity.relata.schema;

import java.util.Locale;

/** Referential action applied to child rows when the referenced parent row is deleted or updated. */
public enum ForeignKeyAction {
  RESTRICT("restrict"),
  CASCADE("cascade"),
  SET_NULL("set null"),
  NO_ACTION("no action");

  private final String sql;

  ForeignKeyAction(String sql) {
    this.sql = sql;
  }

  public String sql() { return sql; }

  /** Accepts {@code set-null}, {@code set_null}, {@code SET NULL} and the like; null means {@link #NO_ACTION}. */
  public static ForeignKeyAction parse(String s) {
    if (s == null || s.isBlank()) return NO_ACTION;
    String norm = s.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    try {
      return valueOf(norm);
    } catch (IllegalArgumentException e) {
      throw new SchemaValidationException("Unknown foreign key action: " + s, e);
    }
  }
}
