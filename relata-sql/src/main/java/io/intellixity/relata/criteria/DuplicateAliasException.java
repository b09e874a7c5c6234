package io.intellixity.relata.criteria;

import io.intellixity.relata.RelataException;

/** Two nodes of one query carry the same explicit alias. */
public final class DuplicateAliasException extends RelataException {
  public DuplicateAliasException(String alias, Object tree) {
    super("Alias '" + alias + "' is used more than once in " + tree);
  }
}
