package io.intellixity.relata.node;

import io.intellixity.relata.projection.ColumnProjection;
import io.intellixity.relata.projection.Projection;
import io.intellixity.relata.projection.RecordProjection;
import io.intellixity.relata.schema.AmbiguousAssociationException;
import io.intellixity.relata.schema.Association;
import io.intellixity.relata.schema.Column;
import io.intellixity.relata.schema.Relation;
import io.intellixity.relata.sql.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A relation (or a join sub-tree) tagged with a query-scoped alias, usable in a FROM clause.
 *
 * <p>Nodes are mutable and owned by the query that builds them: {@link #as(String)} re-aliases in place.
 * Reusing a node in a second join position requires {@link #clone()} first.</p>
 *
 * <p>Equality and hash code are those of the underlying {@link Relation}; the alias never takes part.</p>
 */
public abstract class RelationNode implements Cloneable {
  private static final Logger log = LoggerFactory.getLogger(RelationNode.class);

  /** Sentinel alias; the rendering layer replaces it with a query-unique alias. */
  public static final String DEFAULT_ALIAS = "this";

  private String alias = DEFAULT_ALIAS;

  /** Innermost relation of this node; joins delegate to their left side. */
  public abstract Relation relation();

  /** FROM-clause fragment for this node. */
  public abstract String toSql(Dialect dialect);

  /** Leaf nodes of this tree, left to right. */
  public abstract List<LeafNode> leaves();

  /** Projections this node contributes to a select list, in order. */
  public abstract List<Projection> projections();

  public String alias() { return alias; }

  public RelationNode as(String alias) {
    if (alias == null || alias.isBlank()) throw new IllegalArgumentException("alias is blank");
    this.alias = alias;
    return this;
  }

  public String relationName() { return relation().qualifiedName(); }
  public List<Column> columns() { return relation().columns(); }
  public Optional<Column> primaryKey() { return relation().primaryKey(); }
  public List<Association> associations() { return relation().associations(); }

  /** Projection of the whole record of this node. */
  public RecordProjection all() {
    return new RecordProjection(this);
  }

  public ColumnProjection projection(String column) {
    return new ColumnProjection(this, relation().column(column));
  }

  /** Association from this node's relation to {@code parent}'s relation, both unwrapped to their leaves. */
  public Optional<Association> getParentAssociation(RelationNode parent) {
    Objects.requireNonNull(parent, "parent");
    return relation().getParentAssociation(parent.relation());
  }

  /** Association from {@code child}'s relation to this node's relation. */
  public Optional<Association> getChildAssociation(RelationNode child) {
    Objects.requireNonNull(child, "child");
    return relation().getChildAssociation(child.relation());
  }

  /* JOINS */

  /**
   * Joins {@code node}, inferring the condition from declared associations.
   *
   * <p>An association from this relation to {@code node}'s wins; otherwise one from {@code node}'s relation
   * to this one is used.</p>
   *
   * @throws NoAssociationException when neither side declares an association to the other
   * @throws AmbiguousAssociationException when several associations connect the pair in the chosen direction
   */
  public JoinNode join(RelationNode node, JoinType joinType) {
    Objects.requireNonNull(node, "node");
    Optional<Association> up = getParentAssociation(node);
    if (up.isPresent()) {
      log.debug("relata.join inferred=child_to_parent left={} right={} association={}", this, node, up.get());
      return new ChildToParentJoin(this, node, up.get(), joinType);
    }
    Optional<Association> down = getChildAssociation(node);
    if (down.isPresent()) {
      log.debug("relata.join inferred=parent_to_child left={} right={} association={}", this, node, down.get());
      return new ParentToChildJoin(this, node, down.get(), joinType);
    }
    throw new NoAssociationException(this, node);
  }

  /** Joins {@code node} using {@code association}, whose direction decides the join kind. */
  public JoinNode join(RelationNode node, Association association, JoinType joinType) {
    Objects.requireNonNull(node, "node");
    Objects.requireNonNull(association, "association");
    Relation l = relation();
    Relation r = node.relation();
    if (association.child().equals(l) && association.parent().equals(r)) {
      return new ChildToParentJoin(this, node, association, joinType);
    }
    if (association.parent().equals(l) && association.child().equals(r)) {
      return new ParentToChildJoin(this, node, association, joinType);
    }
    throw new IllegalArgumentException("Association " + association + " does not connect " + this + " and " + node);
  }

  public ExplicitJoin join(RelationNode node, String on, JoinType joinType) {
    return new ExplicitJoin(this, node, joinType, on);
  }

  /* DEFAULT (LEFT) JOINS */

  public JoinNode join(RelationNode node) { return leftJoin(node); }
  public JoinNode join(RelationNode node, Association association) { return leftJoin(node, association); }
  public ExplicitJoin join(RelationNode node, String on) { return leftJoin(node, on); }

  /* LEFT JOINS */

  public JoinNode leftJoin(RelationNode node) { return join(node, JoinType.LEFT); }
  public JoinNode leftJoin(RelationNode node, Association association) { return join(node, association, JoinType.LEFT); }
  public ExplicitJoin leftJoin(RelationNode node, String on) { return join(node, on, JoinType.LEFT); }

  /* RIGHT JOINS */

  public JoinNode rightJoin(RelationNode node) { return join(node, JoinType.RIGHT); }
  public JoinNode rightJoin(RelationNode node, Association association) { return join(node, association, JoinType.RIGHT); }
  public ExplicitJoin rightJoin(RelationNode node, String on) { return join(node, on, JoinType.RIGHT); }

  /* INNER JOINS */

  public JoinNode innerJoin(RelationNode node) { return join(node, JoinType.INNER); }
  public JoinNode innerJoin(RelationNode node, Association association) { return join(node, association, JoinType.INNER); }
  public ExplicitJoin innerJoin(RelationNode node, String on) { return join(node, on, JoinType.INNER); }

  /* FULL JOINS */

  public JoinNode fullJoin(RelationNode node) { return join(node, JoinType.FULL); }
  public JoinNode fullJoin(RelationNode node, Association association) { return join(node, association, JoinType.FULL); }
  public ExplicitJoin fullJoin(RelationNode node, String on) { return join(node, on, JoinType.FULL); }

  /**
   * Shallow copy: a new node over the same relation with the same alias.
   * {@link JoinNode} overrides this with a deep copy of its children.
   */
  @Override
  public RelationNode clone() {
    try {
      return (RelationNode) super.clone();
    } catch (CloneNotSupportedException e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RelationNode n)) return false;
    return relation().equals(n.relation());
  }

  @Override
  public final int hashCode() {
    return relation().hashCode();
  }

  @Override
  public String toString() {
    return relationName() + " as " + alias();
  }
}
