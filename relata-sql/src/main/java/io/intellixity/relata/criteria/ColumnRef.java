package io.intellixity.relata.criteria;

import io.intellixity.relata.node.LeafNode;
import io.intellixity.relata.schema.Column;

import java.util.Objects;

/** A column of one node in a criteria tree, for predicate building. */
public record ColumnRef(LeafNode node, Column column) {
  public ColumnRef {
    Objects.requireNonNull(node, "node");
    Objects.requireNonNull(column, "column");
  }

  public String alias() { return node.alias(); }

  /** {@code alias.column}, the form join conditions use. */
  public String qualified() { return node.alias() + "." + column.name(); }
}
