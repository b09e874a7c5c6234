package io.intellixity.relata.node;

import io.intellixity.relata.schema.Association;

/** Left side is the parent of the association, right side its child. */
public final class ParentToChildJoin extends AssociationJoin {
  public ParentToChildJoin(RelationNode parentNode, RelationNode childNode, Association association, JoinType joinType) {
    super(parentNode, childNode, association, joinType);
  }

  @Override
  public RelationNode childNode() { return right(); }

  @Override
  public RelationNode parentNode() { return left(); }

  @Override
  public ParentToChildJoin as(String alias) {
    super.as(alias);
    return this;
  }

  @Override
  public ParentToChildJoin clone() {
    return (ParentToChildJoin) super.clone();
  }
}
