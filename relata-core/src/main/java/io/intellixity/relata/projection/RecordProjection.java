package io.intellixity.relata.projection;

import io.intellixity.relata.node.RelationNode;
import io.intellixity.relata.schema.Column;
import io.intellixity.relata.sql.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Every column of a node's relation, in declaration order. */
public final class RecordProjection implements Projection {
  private final RelationNode node;

  public RecordProjection(RelationNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  @Override
  public RelationNode node() { return node; }

  public List<ColumnProjection> subProjections() {
    List<ColumnProjection> out = new ArrayList<>();
    for (Column c : node.relation().columns()) out.add(new ColumnProjection(node, c));
    return out;
  }

  @Override
  public List<String> sqlAliases() {
    List<String> out = new ArrayList<>();
    for (Column c : node.relation().columns()) out.add(ColumnProjection.label(node.alias(), c));
    return out;
  }

  @Override
  public String toSql(Dialect dialect) {
    List<String> parts = new ArrayList<>();
    for (ColumnProjection p : subProjections()) parts.add(p.toSql(dialect));
    return String.join(", ", parts);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof RecordProjection p && node == p.node;
  }

  @Override
  public int hashCode() {
    return node.hashCode();
  }

  @Override
  public String toString() {
    return node.alias() + ".*";
  }
}
