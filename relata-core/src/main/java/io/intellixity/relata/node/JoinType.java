package io.intellixity.relata.node;

import io.intellixity.relata.sql.Dialect;

public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  FULL;

  /** Keyword the given dialect uses for this join type. */
  public String keyword(Dialect dialect) {
    return switch (this) {
      case INNER -> dialect.innerJoin();
      case LEFT -> dialect.leftJoin();
      case RIGHT -> dialect.rightJoin();
      case FULL -> dialect.fullJoin();
    };
  }
}
