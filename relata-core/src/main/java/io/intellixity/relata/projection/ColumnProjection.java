package io.intellixity.relata.projection;

import io.intellixity.relata.node.RelationNode;
import io.intellixity.relata.schema.Column;
import io.intellixity.relata.sql.Dialect;

import java.util.List;
import java.util.Objects;

public final class ColumnProjection implements Projection {
  private final RelationNode node;
  private final Column column;

  public ColumnProjection(RelationNode node, Column column) {
    this.node = Objects.requireNonNull(node, "node");
    this.column = Objects.requireNonNull(column, "column");
  }

  @Override
  public RelationNode node() { return node; }

  public Column column() { return column; }

  public String sqlAlias() {
    return label(node.alias(), column);
  }

  @Override
  public List<String> sqlAliases() { return List.of(sqlAlias()); }

  @Override
  public String toSql(Dialect dialect) {
    return dialect.columnAlias(dialect.qualify(node.alias(), column.name()), sqlAlias());
  }

  static String label(String alias, Column column) {
    return alias + "_" + column.name();
  }

  /** Same node instance (not merely the same relation) and same column. */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ColumnProjection p)) return false;
    return node == p.node && column.equals(p.column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(node, column);
  }

  @Override
  public String toString() {
    return node.alias() + "." + column.name();
  }
}
