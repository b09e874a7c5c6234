package io.intellixity.relata.postgres;

import io.intellixity.relata.sql.dialect.AbstractSqlDialect;

/**
 * PostgreSQL dialect.
 *
 * Keeps only Postgres-specific overrides: identifier quoting, the full outer join keyword and
 * LIMIT/OFFSET paging. Generic rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public static final String ID = "postgres";

  @Override public String id() { return ID; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String fullJoin() { return "full outer join"; }

  @Override
  protected String appendPage(String sql, Integer limit, Integer offset) {
    String out = sql;
    if (limit != null) out += " limit " + limit;
    if (offset != null && offset > 0) out += " offset " + offset;
    return out;
  }
}
