package io.intellixity.relata.schema;

import io.intellixity.relata.RelataException;

import java.util.List;

/** More than one association links the same child/parent pair; the caller must pick one explicitly. */
public final class AmbiguousAssociationException extends RelataException {
  private final List<Association> candidates;

  public AmbiguousAssociationException(Relation child, Relation parent, List<Association> candidates) {
    super("Multiple associations from " + child.qualifiedName() + " to " + parent.qualifiedName() +
        ": " + candidates + "; specify the association or an explicit condition");
    this.candidates = List.copyOf(candidates);
  }

  public List<Association> candidates() { return candidates; }
}
