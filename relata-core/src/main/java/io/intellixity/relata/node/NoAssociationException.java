package io.intellixity.relata.node;

import io.intellixity.relata.RelataException;

/** Neither node declares an association to the other, and no explicit association or condition was given. */
public final class NoAssociationException extends RelataException {
  public NoAssociationException(RelationNode left, RelationNode right) {
    super("Failed to join " + left + " with " + right + ": no associations found");
  }
}
