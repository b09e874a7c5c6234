package io.intellixity.relata.criteria;

import io.intellixity.relata.node.LeafNode;
import io.intellixity.relata.node.RelationNode;
import io.intellixity.relata.projection.Projection;
import io.intellixity.relata.schema.Column;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SelectModel;
import io.intellixity.relata.sql.dialect.DialectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Query over a relation node tree.
 *
 * <p>The criteria works on its own deep copy of the root, so the caller's tree is never touched. Every leaf
 * still carrying {@link RelationNode#DEFAULT_ALIAS} receives a query-unique alias ({@code this_1},
 * {@code this_2}, ...) from a {@link RenderContext} private to this criteria; explicit aliases must be unique.</p>
 */
public final class Criteria {
  private static final Logger log = LoggerFactory.getLogger(Criteria.class);

  private final RelationNode root;
  private final Dialect dialect;
  private final RenderContext ctx = new RenderContext();
  private final List<String> restrictions = new ArrayList<>();
  private final List<Object> params = new ArrayList<>();
  private final List<String> orders = new ArrayList<>();
  private Integer limit;
  private Integer offset;

  public Criteria(RelationNode root, Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.root = prepare(Objects.requireNonNull(root, "root").clone());
  }

  /**
   * Criteria rendered by the default dialect. Dialects are discovered on first use and reused;
   * the {@link DialectRegistry#PROPERTY} system property is read on every call.
   */
  public static Criteria of(RelationNode root) {
    return new Criteria(root, SharedRegistry.INSTANCE.defaultDialect());
  }

  private static final class SharedRegistry {
    static final DialectRegistry INSTANCE = new DialectRegistry();
  }

  private RelationNode prepare(RelationNode tree) {
    List<LeafNode> leaves = tree.leaves();
    Set<String> explicit = new HashSet<>();
    for (LeafNode leaf : leaves) {
      if (RelationNode.DEFAULT_ALIAS.equals(leaf.alias())) continue;
      if (!explicit.add(leaf.alias())) throw new DuplicateAliasException(leaf.alias(), tree);
      ctx.reserve(leaf.alias());
    }
    for (LeafNode leaf : leaves) {
      if (RelationNode.DEFAULT_ALIAS.equals(leaf.alias())) {
        leaf.as(ctx.uniqueAlias(RelationNode.DEFAULT_ALIAS));
      }
    }
    return tree;
  }

  /** The criteria's own copy of the tree, with aliases resolved. */
  public RelationNode root() { return root; }

  public Dialect dialect() { return dialect; }

  public List<Projection> projections() { return root.projections(); }

  /** Every column of every leaf, leaves left to right, columns in declaration order. */
  public List<ColumnRef> columns() {
    List<ColumnRef> out = new ArrayList<>();
    for (LeafNode leaf : root.leaves()) {
      for (Column c : leaf.columns()) out.add(new ColumnRef(leaf, c));
    }
    return out;
  }

  /** Column {@code column} of the leaf aliased {@code alias}. */
  public ColumnRef column(String alias, String column) {
    for (LeafNode leaf : root.leaves()) {
      if (leaf.alias().equals(alias)) return new ColumnRef(leaf, leaf.relation().column(column));
    }
    throw new IllegalArgumentException("No node aliased '" + alias + "' in " + root);
  }

  public String fromClause() {
    return root.toSql(dialect);
  }

  /** Adds a restriction, AND-ed with the others; {@code ?} placeholders bind {@code values} in order. */
  public Criteria add(String predicate, Object... values) {
    if (predicate == null || predicate.isBlank()) throw new IllegalArgumentException("predicate is blank");
    int placeholders = countPlaceholders(predicate);
    int given = values == null ? 0 : values.length;
    if (placeholders != given) {
      throw new IllegalArgumentException("Predicate '" + predicate + "' has " + placeholders +
          " placeholders but " + given + " values were given");
    }
    restrictions.add(predicate);
    if (values != null) params.addAll(Arrays.asList(values));
    return this;
  }

  public Criteria addOrder(String order) {
    if (order == null || order.isBlank()) throw new IllegalArgumentException("order is blank");
    orders.add(order);
    return this;
  }

  public Criteria limit(int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    this.limit = limit;
    return this;
  }

  public Criteria offset(int offset) {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    this.offset = offset;
    return this;
  }

  public SelectModel selectModel() {
    return new SelectModel(projections(), root, restrictions, orders, limit, offset);
  }

  public SqlSelect toSql() {
    String sql = dialect.select(selectModel());
    if (log.isDebugEnabled()) {
      log.debug("relata.criteria dialect={} leaves={} paramCount={} sql={}",
          dialect.id(), root.leaves().size(), params.size(), sql);
    }
    return new SqlSelect(sql, params);
  }

  // '?' outside string literals and quoted identifiers; a doubled quote re-enters the same section
  private static int countPlaceholders(String s) {
    int n = 0;
    char quote = 0;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (quote != 0) {
        if (ch == quote) quote = 0;
      } else if (ch == '\'' || ch == '"') {
        quote = ch;
      } else if (ch == '?') {
        n++;
      }
    }
    return n;
  }

  @Override
  public String toString() {
    return "Criteria[" + root + "]";
  }
}
