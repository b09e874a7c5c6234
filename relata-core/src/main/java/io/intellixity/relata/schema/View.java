package io.intellixity.relata.schema;

import io.intellixity.relata.node.ViewNode;

import java.util.List;

/** Read-only relation backed by a stored query. */
public final class View extends Relation {
  /** Defining query, or null when the view is only declared for querying. */
  private final String query;

  View(String schema, String name, List<Column> columns, String primaryKey, String query) {
    super(schema, name, columns, primaryKey);
    this.query = query;
  }

  public String query() { return query; }

  @Override
  public ViewNode node() {
    return new ViewNode(this);
  }

  @Override
  public ViewNode as(String alias) {
    return node().as(alias);
  }
}
