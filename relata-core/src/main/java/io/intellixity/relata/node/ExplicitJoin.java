package io.intellixity.relata.node;

/** Join with a caller-supplied condition, for self-joins and non-FK or composite conditions. */
public final class ExplicitJoin extends JoinNode {
  private final String condition;

  public ExplicitJoin(RelationNode left, RelationNode right, JoinType joinType, String condition) {
    super(left, right, joinType);
    if (condition == null || condition.isBlank()) throw new IllegalArgumentException("join condition is blank");
    this.condition = condition;
  }

  @Override
  public String conditionsExpression() { return condition; }

  @Override
  public ExplicitJoin as(String alias) {
    super.as(alias);
    return this;
  }

  @Override
  public ExplicitJoin clone() {
    return (ExplicitJoin) super.clone();
  }
}
