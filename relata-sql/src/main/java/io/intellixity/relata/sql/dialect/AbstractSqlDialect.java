package io.intellixity.relata.sql.dialect;

import io.intellixity.relata.node.AssociationJoin;
import io.intellixity.relata.node.JoinNode;
import io.intellixity.relata.node.RelationNode;
import io.intellixity.relata.projection.Projection;
import io.intellixity.relata.schema.Association;
import io.intellixity.relata.schema.Relation;
import io.intellixity.relata.schema.Table;
import io.intellixity.relata.schema.View;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SelectModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic SQL dialect base.
 *
 * Provides common rendering for:
 * - leaves: qualified relation name followed by {@code as alias}
 * - joins: left side, keyword, right side (parenthesised when it is a join itself), ON clause
 * - selects: projections, FROM tree, AND-ed restrictions, ordering, paging
 *
 * DB-specific dialects override hooks for quoting, join keywords and paging.
 */
public abstract class AbstractSqlDialect implements Dialect {

  @Override
  public String tableAlias(Table table, String alias) {
    return relationName(table) + " as " + alias;
  }

  @Override
  public String viewAlias(View view, String alias) {
    return relationName(view) + " as " + alias;
  }

  @Override
  public String join(JoinNode join) {
    RelationNode right = join.right();
    String rightSql = right instanceof JoinNode ? "(" + right.toSql(this) + ")" : right.toSql(this);
    return join.left().toSql(this) + " " + join.joinType().keyword(this) + " " + rightSql + " " + onClause(join);
  }

  /**
   * ON subclause. Association joins qualify both key columns through {@link #qualify(String, String)},
   * matching the select list; explicit joins keep the caller's condition as written.
   */
  protected String onClause(JoinNode join) {
    if (join instanceof AssociationJoin aj) {
      Association a = aj.association();
      return "on (" + qualify(aj.childNode().alias(), a.childColumn().name()) + " = " +
          qualify(aj.parentNode().alias(), a.parentColumn().name()) + ")";
    }
    return join.on();
  }

  @Override public String innerJoin() { return "inner join"; }
  @Override public String leftJoin() { return "left join"; }
  @Override public String rightJoin() { return "right join"; }
  @Override public String fullJoin() { return "full join"; }

  @Override
  public String qualify(String alias, String column) {
    return alias + "." + quoteIdent(column);
  }

  @Override
  public String columnAlias(String expression, String alias) {
    return expression + " as " + alias;
  }

  @Override
  public String select(SelectModel select) {
    StringBuilder sql = new StringBuilder("select ");
    List<String> items = new ArrayList<>();
    for (Projection p : select.projections()) {
      String s = p.toSql(this);
      if (!s.isBlank()) items.add(s);
    }
    sql.append(items.isEmpty() ? "*" : String.join(", ", items));
    sql.append(" from ").append(select.from().toSql(this));

    if (!select.where().isEmpty()) {
      sql.append(" where ");
      if (select.where().size() == 1) {
        sql.append(select.where().get(0));
      } else {
        List<String> wrapped = new ArrayList<>();
        for (String w : select.where()) wrapped.add("(" + w + ")");
        sql.append(String.join(" and ", wrapped));
      }
    }
    if (!select.orderBy().isEmpty()) {
      sql.append(" order by ").append(String.join(", ", select.orderBy()));
    }
    return appendPage(sql.toString(), select.limit(), select.offset());
  }

  /** Default is SQL:2008 {@code offset ... rows fetch first ... rows only}; dialects override. */
  protected String appendPage(String sql, Integer limit, Integer offset) {
    String out = sql;
    if (offset != null && offset > 0) out += " offset " + offset + " rows";
    if (limit != null) out += " fetch first " + limit + " rows only";
    return out;
  }

  /** Schema-qualified, quoted relation name. */
  protected String relationName(Relation relation) {
    if (relation.schema() == null) return quoteIdent(relation.name());
    return quoteIdent(relation.schema()) + "." + quoteIdent(relation.name());
  }
}
