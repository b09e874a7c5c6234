package io.intellixity.relata.schema;

import java.util.Objects;

/**
 * Foreign-key edge from a child relation column to a parent relation column.
 *
 * Identity is (child, parent, childColumn); actions and the parent column do not take part in equality.
 */
public final class Association {
  private final Relation child;
  private final Relation parent;
  private final Column childColumn;
  private final Column parentColumn;
  private final ForeignKeyAction onDelete;
  private final ForeignKeyAction onUpdate;

  public Association(Relation child, Column childColumn, Relation parent, Column parentColumn,
                     ForeignKeyAction onDelete, ForeignKeyAction onUpdate) {
    this.child = Objects.requireNonNull(child, "child");
    this.parent = Objects.requireNonNull(parent, "parent");
    this.childColumn = Objects.requireNonNull(childColumn, "childColumn");
    this.parentColumn = Objects.requireNonNull(parentColumn, "parentColumn");
    this.onDelete = onDelete == null ? ForeignKeyAction.NO_ACTION : onDelete;
    this.onUpdate = onUpdate == null ? ForeignKeyAction.NO_ACTION : onUpdate;

    if (!childColumn.type().comparableWith(parentColumn.type())) {
      throw new SchemaValidationException("Association " + child.qualifiedName() + "." + childColumn.name() +
          " (" + childColumn.type().id() + ") is not comparable with " + parent.qualifiedName() + "." +
          parentColumn.name() + " (" + parentColumn.type().id() + ")");
    }
  }

  public Relation child() { return child; }
  public Relation parent() { return parent; }
  public Column childColumn() { return childColumn; }
  public Column parentColumn() { return parentColumn; }
  public ForeignKeyAction onDelete() { return onDelete; }
  public ForeignKeyAction onUpdate() { return onUpdate; }

  /** True when the child relation references itself (e.g. a parent_id tree). */
  public boolean selfReferencing() { return child.equals(parent); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Association a)) return false;
    return child.equals(a.child) && parent.equals(a.parent) && childColumn.name().equals(a.childColumn.name());
  }

  @Override
  public int hashCode() {
    return Objects.hash(child, parent, childColumn.name());
  }

  @Override
  public String toString() {
    return child.qualifiedName() + "." + childColumn.name() + " -> " + parent.qualifiedName() + "." + parentColumn.name();
  }
}
