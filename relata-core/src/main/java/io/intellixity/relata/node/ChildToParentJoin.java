package io.intellixity.relata.node;

import io.intellixity.relata.schema.Association;

/** Left side is the child of the association, right side its parent. */
public final class ChildToParentJoin extends AssociationJoin {
  public ChildToParentJoin(RelationNode childNode, RelationNode parentNode, Association association, JoinType joinType) {
    super(childNode, parentNode, association, joinType);
  }

  @Override
  public RelationNode childNode() { return left(); }

  @Override
  public RelationNode parentNode() { return right(); }

  @Override
  public ChildToParentJoin as(String alias) {
    super.as(alias);
    return this;
  }

  @Override
  public ChildToParentJoin clone() {
    return (ChildToParentJoin) super.clone();
  }
}
