package io.intellixity.relata.projection;

import io.intellixity.relata.node.RelationNode;
import io.intellixity.relata.sql.Dialect;

import java.util.List;

/** One or more output columns a node contributes to a query's result shape. */
public interface Projection {
  RelationNode node();

  /** Result-set labels, in select-list order. Derived from the node's current alias. */
  List<String> sqlAliases();

  /** Select-list fragment. */
  String toSql(Dialect dialect);
}
