package io.intellixity.relata.projection;

import io.intellixity.relata.Bookstore;
import io.intellixity.relata.node.TableNode;
import io.intellixity.relata.schema.Schema;
import io.intellixity.relata.schema.Table;
import io.intellixity.relata.schema.View;
import io.intellixity.relata.node.JoinNode;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SelectModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ProjectionTest {
  private final Schema schema = Bookstore.schema();

  /** Quotes column names so rendering hooks are visible in assertions. */
  private static final Dialect QUOTING = new Dialect() {
    @Override public String id() { return "quoting"; }
    @Override public String tableAlias(Table table, String alias) { throw new UnsupportedOperationException(); }
    @Override public String viewAlias(View view, String alias) { throw new UnsupportedOperationException(); }
    @Override public String join(JoinNode join) { throw new UnsupportedOperationException(); }
    @Override public String innerJoin() { return "inner join"; }
    @Override public String leftJoin() { return "left join"; }
    @Override public String rightJoin() { return "right join"; }
    @Override public String fullJoin() { return "full join"; }
    @Override public String quoteIdent(String ident) { return "`" + ident + "`"; }
    @Override public String qualify(String alias, String column) { return alias + "." + quoteIdent(column); }
    @Override public String columnAlias(String expression, String alias) { return expression + " as " + alias; }
    @Override public String select(SelectModel select) { throw new UnsupportedOperationException(); }
  };

  @Test
  void recordProjectionRendersEveryColumn() {
    TableNode c = schema.table("category").as("c");
    assertEquals("c.`id` as c_id, c.`name` as c_name, c.`parent_id` as c_parent_id", c.all().toSql(QUOTING));
    assertEquals(3, c.all().subProjections().size());
  }

  @Test
  void columnProjectionRendersOneColumn() {
    TableNode b = schema.table("book").as("b");
    ColumnProjection p = b.projection("title");
    assertEquals("b.`title` as b_title", p.toSql(QUOTING));
    assertEquals("b_title", p.sqlAlias());
    assertEquals("b.title", p.toString());
  }

  @Test
  void aliasesAreReadAtRenderTime() {
    TableNode b = schema.table("book").node();
    RecordProjection p = b.all();
    b.as("later");
    assertEquals(List.of("later_id", "later_title", "later_category_id"), p.sqlAliases());
  }

  @Test
  void projectionsOfDifferentNodesOverTheSameRelationDiffer() {
    TableNode c1 = schema.table("category").as("c1");
    TableNode c2 = schema.table("category").as("c2");
    assertEquals(c1, c2);
    assertNotEquals(c1.all(), c2.all());
    assertNotEquals(c1.projection("id"), c2.projection("id"));
    assertEquals(c1.projection("id"), c1.projection("id"));
  }
}
