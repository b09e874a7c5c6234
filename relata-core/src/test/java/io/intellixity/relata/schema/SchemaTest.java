package io.intellixity.relata.schema;

import io.intellixity.relata.Bookstore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaTest {
  private final Schema schema = Bookstore.schema();

  @Test
  void bindsAssociationWithDeclaredActions() {
    Table book = schema.table("book");
    Table category = schema.table("category");

    Association a = book.getParentAssociation(category).orElseThrow();
    assertEquals("category_id", a.childColumn().name());
    assertEquals("id", a.parentColumn().name());
    assertEquals(ForeignKeyAction.SET_NULL, a.onDelete());
    assertEquals(ForeignKeyAction.CASCADE, a.onUpdate());
    assertSame(book, a.child());
    assertSame(category, a.parent());
    assertFalse(a.selfReferencing());
  }

  @Test
  void parentColumnDefaultsToPrimaryKey() {
    Association a = schema.table("category").getParentAssociation(schema.table("category")).orElseThrow();
    assertEquals("parent_id", a.childColumn().name());
    assertEquals("id", a.parentColumn().name());
    assertTrue(a.selfReferencing());
    assertEquals(ForeignKeyAction.NO_ACTION, a.onDelete());
  }

  @Test
  void childAssociationLooksUpTheOtherSide() {
    Table book = schema.table("book");
    Table category = schema.table("category");
    assertEquals(book.getParentAssociation(category), category.getChildAssociation(book));
    assertEquals(Optional.empty(), book.getChildAssociation(category));
  }

  @Test
  void reverseLookupListsIncomingAssociations() {
    Table category = schema.table("category");
    List<Association> in = schema.incomingAssociations(category);
    assertEquals(3, in.size());
    assertTrue(in.stream().anyMatch(a -> a.child().name().equals("book")));
    assertTrue(in.stream().anyMatch(a -> a.child().name().equals("book_stats")));
    assertTrue(in.stream().anyMatch(Association::selfReferencing));
    assertEquals(List.of(), schema.incomingAssociations(schema.table("tag")));
  }

  @Test
  void multipleAssociationsToSameParentAreAmbiguous() {
    Table shipment = schema.table("shipment");
    Table city = schema.table("city");
    AmbiguousAssociationException ex = assertThrows(AmbiguousAssociationException.class,
        () -> shipment.getParentAssociation(city));
    assertEquals(2, ex.candidates().size());
    assertEquals(2, shipment.associations().size());
  }

  @Test
  void rejectsIncomparableColumnTypes() {
    SchemaValidationException ex = assertThrows(SchemaValidationException.class, () -> Schema.builder()
        .table("author", t -> t.id("id", ColumnType.BIGINT))
        .table("book", t -> t.id("id", ColumnType.BIGINT)
            .column("author_id", ColumnType.VARCHAR)
            .references("author_id", "author"))
        .build());
    assertTrue(ex.getMessage().contains("not comparable"));
  }

  @Test
  void numericTypesOfDifferentWidthAreComparable() {
    Schema s = Schema.builder()
        .table("author", t -> t.id("id", ColumnType.BIGINT))
        .table("book", t -> t.id("id", ColumnType.BIGINT)
            .column("author_id", ColumnType.INTEGER)
            .references("author_id", "author"))
        .build();
    assertTrue(s.table("book").getParentAssociation(s.table("author")).isPresent());
  }

  @Test
  void referenceToParentWithoutPrimaryKeyNeedsParentColumn() {
    assertThrows(SchemaValidationException.class, () -> Schema.builder()
        .table("code", t -> t.column("value", ColumnType.VARCHAR))
        .table("item", t -> t.id("id", ColumnType.BIGINT)
            .column("code", ColumnType.VARCHAR)
            .references("code", "code"))
        .build());

    Schema s = Schema.builder()
        .table("code", t -> t.column("value", ColumnType.VARCHAR))
        .table("item", t -> t.id("id", ColumnType.BIGINT)
            .column("code", ColumnType.VARCHAR)
            .references("code", "code", "value", null, null))
        .build();
    assertEquals("value", s.table("item").associations().get(0).parentColumn().name());
  }

  @Test
  void rejectsUnknownRelationsAndColumns() {
    assertThrows(SchemaValidationException.class, () -> Schema.builder()
        .table("book", t -> t.id("id", ColumnType.BIGINT)
            .column("category_id", ColumnType.BIGINT)
            .references("category_id", "category"))
        .build());
    assertThrows(SchemaValidationException.class, () -> Schema.builder()
        .table("book", t -> t.id("id", ColumnType.BIGINT).references("missing", "book"))
        .build());
    assertThrows(SchemaValidationException.class, () -> schema.relation("nope"));
    assertThrows(SchemaValidationException.class, () -> schema.table("book").column("nope"));
  }

  @Test
  void rejectsDuplicateRelationsAndColumns() {
    assertThrows(SchemaValidationException.class, () -> Schema.builder()
        .table("book", t -> t.id("id", ColumnType.BIGINT))
        .table("book", t -> t.id("id", ColumnType.BIGINT))
        .build());
    assertThrows(SchemaValidationException.class, () -> Schema.builder()
        .table("book", t -> t.id("id", ColumnType.BIGINT).column("id", ColumnType.BIGINT))
        .build());
  }

  @Test
  void resolvesNamesThroughDefaultSchema() {
    Schema s = Schema.builder()
        .defaultSchema("shop")
        .table("category", t -> t.id("id", ColumnType.BIGINT))
        .table("archive", "category", t -> t.id("id", ColumnType.BIGINT))
        .table("book", t -> t.id("id", ColumnType.BIGINT)
            .column("category_id", ColumnType.BIGINT)
            .references("category_id", "archive.category"))
        .build();

    assertEquals("shop.category", s.relation("category").qualifiedName());
    assertEquals("archive.category", s.relation("archive.category").qualifiedName());
    assertEquals("shop.book", s.relation("book").qualifiedName());
    assertEquals("archive.category", s.table("book").associations().get(0).parent().qualifiedName());
  }

  @Test
  void relationsAreEqualByQualifiedName() {
    Schema other = Bookstore.schema();
    assertEquals(schema.table("book"), other.table("book"));
    assertEquals(schema.table("book").hashCode(), other.table("book").hashCode());
    assertNotEquals(schema.table("book"), schema.table("category"));
  }

  @Test
  void viewsCarryTheirQuery() {
    View v = schema.view("book_stats");
    assertTrue(v.query().startsWith("select category_id"));
    assertTrue(v.primaryKey().isEmpty());
    assertThrows(SchemaValidationException.class, () -> schema.view("book"));
  }

  @Test
  void columnTypesParseFromIds() {
    assertEquals(ColumnType.BIGINT, ColumnType.fromId("long"));
    assertEquals(ColumnType.VARCHAR, ColumnType.fromId(" String "));
    assertEquals(ColumnType.UUID, ColumnType.fromId("uuid"));
    assertThrows(SchemaValidationException.class, () -> ColumnType.fromId("blob"));
    assertTrue(ColumnType.DATE.comparableWith(ColumnType.TIMESTAMP));
    assertFalse(ColumnType.UUID.comparableWith(ColumnType.VARCHAR));
    assertEquals(ColumnType.Domain.NUMERIC, ColumnType.INTEGER.domain());
  }

  @Test
  void uniquenessIsAColumnAttribute() {
    Column name = schema.table("category").column("name");
    assertTrue(name.unique());
    assertFalse(name.nullable());
    assertFalse(schema.table("book").column("title").unique());

    Column c = Column.of("code", ColumnType.VARCHAR);
    assertFalse(c.unique());
    assertTrue(c.asUnique().unique());
    assertEquals(c.asUnique(), new Column("code", ColumnType.VARCHAR, true, true, null));
  }

  @Test
  void findColumnIsTheLenientLookup() {
    Table book = schema.table("book");
    assertEquals(Optional.of(book.column("title")), book.findColumn("title"));
    assertEquals(Optional.empty(), book.findColumn("isbn"));
    assertThrows(SchemaValidationException.class, () -> book.column("isbn"));
  }

  @Test
  void foreignKeyActionsParseLeniently() {
    assertEquals(ForeignKeyAction.SET_NULL, ForeignKeyAction.parse("set-null"));
    assertEquals(ForeignKeyAction.SET_NULL, ForeignKeyAction.parse("SET NULL"));
    assertEquals(ForeignKeyAction.NO_ACTION, ForeignKeyAction.parse(null));
    assertEquals("no action", ForeignKeyAction.parse("no_action").sql());
    assertThrows(SchemaValidationException.class, () -> ForeignKeyAction.parse("explode"));
  }
}
