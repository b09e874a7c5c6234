package io.intellixity.relata.schema;

import io.intellixity.relata.node.TableNode;

import java.util.List;

public final class Table extends Relation {
  Table(String schema, String name, List<Column> columns, String primaryKey) {
    super(schema, name, columns, primaryKey);
  }

  @Override
  public TableNode node() {
    return new TableNode(this);
  }

  @Override
  public TableNode as(String alias) {
    return node().as(alias);
  }
}
