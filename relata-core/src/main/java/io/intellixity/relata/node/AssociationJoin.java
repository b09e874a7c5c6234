package io.intellixity.relata.node;

import io.intellixity.relata.schema.Association;

import java.util.Objects;

/** Join whose condition is derived from an {@link Association}. */
public abstract class AssociationJoin extends JoinNode {
  private final Association association;

  protected AssociationJoin(RelationNode left, RelationNode right, Association association, JoinType joinType) {
    super(left, right, joinType);
    this.association = Objects.requireNonNull(association, "association");
  }

  public Association association() { return association; }

  public abstract RelationNode childNode();
  public abstract RelationNode parentNode();

  @Override
  public String conditionsExpression() {
    return childNode().alias() + "." + association.childColumn().name() + " = " +
        parentNode().alias() + "." + association.parentColumn().name();
  }
}
