package io.intellixity.relata.schema.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.relata.schema.*;

import java.io.IOException;
import java.util.Locale;

/**
 * Canonical JSON deserializer for {@link Schema}.
 *
 * <pre>
 * { "schema": "public",
 *   "relations": [
 *     { "kind": "table", "name": "book", "primaryKey": "id",
 *       "columns": [ {"name": "id", "type": "long", "nullable": false} ],
 *       "associations": [ {"column": "category_id", "references": "category", "onDelete": "set-null"} ] } ] }
 * </pre>
 */
public final class SchemaJsonDeserializer extends JsonDeserializer<Schema> {
  @Override
  public Schema deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new SchemaValidationException("Schema JSON must be an object");

    Schema.Builder b = Schema.builder().defaultSchema(textOrNull(root.get("schema")));

    JsonNode relations = root.get("relations");
    if (relations == null || !relations.isArray()) {
      throw new SchemaValidationException("Schema JSON requires a 'relations' array");
    }
    for (JsonNode r : relations) {
      if (!r.isObject()) throw new SchemaValidationException("relation entry must be an object: " + r);
      String name = requiredText(r, "name", "relation");
      String schema = textOrNull(r.get("schema"));
      String kind = textOrNull(r.get("kind"));
      if (kind == null || "table".equals(kind.toLowerCase(Locale.ROOT))) {
        b.table(schema, name, rb -> readRelation(r, rb));
      } else if ("view".equals(kind.toLowerCase(Locale.ROOT))) {
        b.view(schema, name, rb -> readRelation(r, rb).query(textOrNull(r.get("query"))));
      } else {
        throw new SchemaValidationException("Unknown relation kind '" + kind + "' for " + name);
      }
    }
    return b.build();
  }

  private static Schema.RelationBuilder readRelation(JsonNode r, Schema.RelationBuilder rb) {
    String owner = textOrNull(r.get("name"));
    JsonNode columns = r.get("columns");
    if (columns != null && columns.isArray()) {
      for (JsonNode c : columns) rb.column(readColumn(c, owner));
    }
    rb.primaryKey(textOrNull(r.get("primaryKey")));

    JsonNode assocs = r.get("associations");
    if (assocs != null && assocs.isArray()) {
      for (JsonNode a : assocs) {
        String column = requiredText(a, "column", "association of " + owner);
        String references = requiredText(a, "references", "association of " + owner);
        rb.references(column, references, textOrNull(a.get("parentColumn")),
            ForeignKeyAction.parse(textOrNull(a.get("onDelete"))),
            ForeignKeyAction.parse(textOrNull(a.get("onUpdate"))));
      }
    }
    return rb;
  }

  private static Column readColumn(JsonNode c, String owner) {
    if (!c.isObject()) throw new SchemaValidationException("column entry must be an object in " + owner + ": " + c);
    String name = requiredText(c, "name", "column of " + owner);
    ColumnType type = ColumnType.fromId(requiredText(c, "type", "column " + owner + "." + name));
    Column col = Column.of(name, type);
    JsonNode nullable = c.get("nullable");
    if (nullable != null && !nullable.isNull() && !nullable.asBoolean(true)) col = col.notNull();
    JsonNode unique = c.get("unique");
    if (unique != null && unique.asBoolean(false)) col = col.asUnique();
    String def = textOrNull(c.get("default"));
    if (def != null) col = col.defaultsTo(def);
    return col;
  }

  private static String requiredText(JsonNode n, String field, String what) {
    String s = textOrNull(n.get(field));
    if (s == null || s.isBlank()) throw new SchemaValidationException("'" + field + "' is required for " + what);
    return s;
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return n.asText();
  }
}
