package io.intellixity.relata.sql;

import io.intellixity.relata.node.JoinNode;
import io.intellixity.relata.schema.Table;
import io.intellixity.relata.schema.View;

/**
 * Renders relation nodes, joins and selects to SQL text.
 *
 * Nodes call back into the dialect from {@code toSql}; the dialect never mutates the tree it is given.
 * Implementations are stateless and may be shared between threads.
 */
public interface Dialect {
  String id();

  /** FROM fragment for a table leaf, e.g. {@code public.book as b}. */
  String tableAlias(Table table, String alias);

  /** FROM fragment for a view leaf. */
  String viewAlias(View view, String alias);

  /** Full join fragment: left side, join keyword, right side and ON clause. */
  String join(JoinNode join);

  String innerJoin();
  String leftJoin();
  String rightJoin();
  String fullJoin();

  String quoteIdent(String ident);

  /** Column reference qualified by a node alias. */
  String qualify(String alias, String column);

  /** Select-list item: {@code expression} labelled {@code alias}. */
  String columnAlias(String expression, String alias);

  String select(SelectModel select);
}
