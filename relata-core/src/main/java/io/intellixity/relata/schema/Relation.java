package io.intellixity.relata.schema;

import io.intellixity.relata.node.RelationNode;

import java.util.*;

/**
 * Named source of rows (table or view).
 *
 * Relations are built once by {@link Schema.Builder} and are read-only afterwards, so a single
 * instance is shared by every query that references it. Equality is the qualified name.
 */
public abstract class Relation {
  private final String schema;
  private final String name;
  private final String qualifiedName;
  private final List<Column> columns;
  private final Map<String, Column> columnsByName;
  private final Column primaryKey;
  private List<Association> associations;

  protected Relation(String schema, String name, List<Column> columns, String primaryKey) {
    if (name == null || name.isBlank()) throw new SchemaValidationException("relation name is blank");
    this.schema = (schema == null || schema.isBlank()) ? null : schema.trim();
    this.name = name.trim();
    this.qualifiedName = this.schema == null ? this.name : this.schema + "." + this.name;

    Map<String, Column> byName = new LinkedHashMap<>();
    for (Column c : columns == null ? List.<Column>of() : columns) {
      if (byName.put(c.name(), c) != null) {
        throw new SchemaValidationException("Duplicate column '" + c.name() + "' in " + qualifiedName);
      }
    }
    this.columns = List.copyOf(byName.values());
    this.columnsByName = Collections.unmodifiableMap(byName);

    if (primaryKey == null || primaryKey.isBlank()) {
      this.primaryKey = null;
    } else {
      this.primaryKey = column(primaryKey);
    }
  }

  public String schema() { return schema; }
  public String name() { return name; }
  public String qualifiedName() { return qualifiedName; }
  public List<Column> columns() { return columns; }
  public Optional<Column> primaryKey() { return Optional.ofNullable(primaryKey); }

  public Optional<Column> findColumn(String columnName) {
    return Optional.ofNullable(columnsByName.get(columnName));
  }

  public Column column(String columnName) {
    return findColumn(columnName).orElseThrow(() ->
        new SchemaValidationException("Unknown column '" + columnName + "' in " + qualifiedName));
  }

  /** Outgoing associations (this relation is the child), in declaration order. */
  public List<Association> associations() {
    return associations == null ? List.of() : associations;
  }

  /**
   * The single association from this relation to {@code parent}, if any.
   *
   * @throws AmbiguousAssociationException when more than one association points at {@code parent}
   */
  public Optional<Association> getParentAssociation(Relation parent) {
    Objects.requireNonNull(parent, "parent");
    List<Association> found = new ArrayList<>(1);
    for (Association a : associations()) {
      if (a.parent().equals(parent)) found.add(a);
    }
    if (found.isEmpty()) return Optional.empty();
    if (found.size() > 1) throw new AmbiguousAssociationException(this, parent, found);
    return Optional.of(found.get(0));
  }

  /** The single association from {@code child} to this relation, if any. */
  public Optional<Association> getChildAssociation(Relation child) {
    Objects.requireNonNull(child, "child");
    return child.getParentAssociation(this);
  }

  /** New leaf node over this relation, carrying the default alias. */
  public abstract RelationNode node();

  /** New leaf node over this relation with the given alias. */
  public RelationNode as(String alias) {
    return node().as(alias);
  }

  void bindAssociations(List<Association> bound) {
    if (associations != null) throw new IllegalStateException("Associations already bound for " + qualifiedName);
    associations = List.copyOf(bound);
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Relation r)) return false;
    return qualifiedName.equals(r.qualifiedName);
  }

  @Override
  public final int hashCode() {
    return qualifiedName.hashCode();
  }

  @Override
  public String toString() {
    return qualifiedName;
  }
}
