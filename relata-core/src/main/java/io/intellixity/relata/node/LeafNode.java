package io.intellixity.relata.node;

import io.intellixity.relata.projection.Projection;
import io.intellixity.relata.schema.Relation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Node wrapping a {@link Relation} directly. */
public abstract class LeafNode extends RelationNode {
  private final Relation relation;
  /** Null means the whole record is projected. */
  private List<String> projectedColumns;

  protected LeafNode(Relation relation) {
    this.relation = Objects.requireNonNull(relation, "relation");
  }

  @Override
  public Relation relation() { return relation; }

  @Override
  public List<LeafNode> leaves() { return List.of(this); }

  @Override
  public List<Projection> projections() {
    if (projectedColumns == null) return List.of(all());
    List<Projection> out = new ArrayList<>(projectedColumns.size());
    for (String c : projectedColumns) out.add(projection(c));
    return out;
  }

  /** Narrows this node's projections to the given columns; no columns restores the whole record. */
  public LeafNode project(String... columns) {
    if (columns == null || columns.length == 0) {
      projectedColumns = null;
      return this;
    }
    for (String c : columns) relation.column(c);
    projectedColumns = List.of(columns);
    return this;
  }

  @Override
  public LeafNode as(String alias) {
    super.as(alias);
    return this;
  }

  @Override
  public LeafNode clone() {
    return (LeafNode) super.clone();
  }
}
