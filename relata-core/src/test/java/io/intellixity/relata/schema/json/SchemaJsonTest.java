package io.intellixity.relata.schema.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.schema.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void loadsRelationsColumnsAndAssociations() {
    Schema schema = SchemaJson.loadResource("bookstore-schema.json");

    Table book = schema.table("book");
    assertEquals("public.book", book.qualifiedName());
    assertEquals(4, book.columns().size());
    assertEquals("id", book.primaryKey().orElseThrow().name());

    Column title = book.column("title");
    assertEquals(ColumnType.VARCHAR, title.type());
    assertFalse(title.nullable());
    assertEquals("now()", book.column("created_at").defaultExpression());
    assertTrue(schema.table("category").column("name").unique());

    Association a = book.getParentAssociation(schema.table("category")).orElseThrow();
    assertEquals(ForeignKeyAction.SET_NULL, a.onDelete());
    assertEquals(ForeignKeyAction.CASCADE, a.onUpdate());

    View stats = schema.view("book_stats");
    assertNotNull(stats.query());
    assertEquals(3, schema.incomingAssociations(schema.table("category")).size());
  }

  @Test
  void deserializesThroughObjectMapper() throws Exception {
    String s = """
        {
          "relations": [
            { "name": "category", "primaryKey": "id",
              "columns": [ { "name": "id", "type": "int" } ] }
          ]
        }
        """;
    Schema schema = JSON.readValue(s, Schema.class);
    Table category = schema.table("category");
    assertNull(category.schema());
    assertEquals(ColumnType.INTEGER, category.column("id").type());
  }

  @Test
  void rejectsMissingRelationsArray() {
    assertThrows(SchemaValidationException.class, () -> SchemaJson.parse("{ \"schema\": \"public\" }"));
  }

  @Test
  void rejectsUnknownKindAndType() {
    assertThrows(SchemaValidationException.class, () -> SchemaJson.parse("""
        { "relations": [ { "kind": "sequence", "name": "seq" } ] }
        """));
    assertThrows(SchemaValidationException.class, () -> SchemaJson.parse("""
        { "relations": [ { "name": "t", "columns": [ { "name": "c", "type": "blob" } ] } ] }
        """));
  }

  @Test
  void wrapsSyntaxErrors() {
    SchemaValidationException ex = assertThrows(SchemaValidationException.class, () -> SchemaJson.parse("{ nope"));
    assertTrue(ex.getMessage().startsWith("Malformed schema JSON"));
  }

  @Test
  void missingResourceFails() {
    assertThrows(SchemaValidationException.class, () -> SchemaJson.loadResource("no-such-schema.json"));
  }
}
