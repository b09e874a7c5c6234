package io.intellixity.relata.node;

import io.intellixity.relata.schema.Table;
import io.intellixity.relata.sql.Dialect;

public final class TableNode extends LeafNode {
  private final Table table;

  public TableNode(Table table) {
    super(table);
    this.table = table;
  }

  public Table table() { return table; }

  /** Dialect returns the qualified name with alias, e.g. {@code myschema.mytable as myalias}. */
  @Override
  public String toSql(Dialect dialect) {
    return dialect.tableAlias(table, alias());
  }

  @Override
  public TableNode as(String alias) {
    super.as(alias);
    return this;
  }

  @Override
  public TableNode project(String... columns) {
    super.project(columns);
    return this;
  }

  @Override
  public TableNode clone() {
    return (TableNode) super.clone();
  }
}
