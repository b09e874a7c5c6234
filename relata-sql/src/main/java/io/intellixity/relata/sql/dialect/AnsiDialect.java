package io.intellixity.relata.sql.dialect;

/** Plain SQL with unquoted identifiers. */
public final class AnsiDialect extends AbstractSqlDialect {
  public static final String ID = "ansi";

  @Override public String id() { return ID; }

  @Override
  public String quoteIdent(String ident) {
    return ident;
  }
}
