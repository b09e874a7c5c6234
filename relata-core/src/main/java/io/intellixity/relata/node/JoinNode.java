package io.intellixity.relata.node;

import io.intellixity.relata.projection.Projection;
import io.intellixity.relata.schema.Relation;
import io.intellixity.relata.sql.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Binary join of two nodes. A join "is" its left side: relation and alias delegate to {@link #left()},
 * so it can be chained into further joins.
 */
public abstract class JoinNode extends RelationNode {
  private RelationNode left;
  private RelationNode right;
  private final JoinType joinType;

  protected JoinNode(RelationNode left, RelationNode right, JoinType joinType) {
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
    this.joinType = Objects.requireNonNull(joinType, "joinType");
  }

  public RelationNode left() { return left; }
  public RelationNode right() { return right; }
  public JoinType joinType() { return joinType; }

  @Override
  public Relation relation() { return left.relation(); }

  @Override
  public String alias() { return left.alias(); }

  /** Re-aliases the left side. */
  @Override
  public JoinNode as(String alias) {
    left.as(alias);
    return this;
  }

  /** SQL boolean expression joining left and right, computed from their current aliases. */
  public abstract String conditionsExpression();

  /** The ON subclause for this join. */
  public String on() {
    return "on (" + conditionsExpression() + ")";
  }

  /** Copy of this join over the same children, with an explicit condition. */
  public ExplicitJoin on(String condition) {
    return new ExplicitJoin(left, right, joinType, condition);
  }

  /** Left projections followed by right projections, whatever the join type. */
  @Override
  public List<Projection> projections() {
    List<Projection> out = new ArrayList<>(left.projections());
    out.addAll(right.projections());
    return out;
  }

  @Override
  public List<LeafNode> leaves() {
    List<LeafNode> out = new ArrayList<>(left.leaves());
    out.addAll(right.leaves());
    return out;
  }

  public JoinNode replaceLeft(RelationNode newLeft) {
    this.left = Objects.requireNonNull(newLeft, "newLeft");
    return this;
  }

  public JoinNode replaceRight(RelationNode newRight) {
    this.right = Objects.requireNonNull(newRight, "newRight");
    return this;
  }

  @Override
  public String toSql(Dialect dialect) {
    return dialect.join(this);
  }

  /** Deep copy: both children are cloned recursively; relations stay shared. */
  @Override
  public JoinNode clone() {
    JoinNode copy = (JoinNode) super.clone();
    return copy.replaceLeft(left.clone()).replaceRight(right.clone());
  }

  @Override
  public String toString() {
    return "(" + left + " " + joinType + " " + right + ")";
  }
}
