package io.intellixity.relata.schema;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.relata.schema.json.SchemaJsonDeserializer;

import java.util.*;
import java.util.function.Consumer;

/**
 * Immutable registry of relations and their associations.
 *
 * Built once via {@link #builder()} (or read from JSON), then shared by any number of concurrent
 * query builds.
 */
@JsonDeserialize(using = SchemaJsonDeserializer.class)
public final class Schema {
  private final Map<String, Relation> relations;
  private final Map<Relation, List<Association>> incoming;
  private final String defaultSchema;

  private Schema(String defaultSchema, Map<String, Relation> relations) {
    this.defaultSchema = defaultSchema;
    this.relations = Collections.unmodifiableMap(relations);

    Map<Relation, List<Association>> in = new HashMap<>();
    for (Relation r : relations.values()) {
      for (Association a : r.associations()) {
        in.computeIfAbsent(a.parent(), k -> new ArrayList<>()).add(a);
      }
    }
    Map<Relation, List<Association>> frozen = new HashMap<>();
    in.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
    this.incoming = Collections.unmodifiableMap(frozen);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Collection<Relation> relations() { return relations.values(); }

  public Optional<Relation> findRelation(String name) {
    return Optional.ofNullable(resolve(relations, defaultSchema, name));
  }

  public Relation relation(String name) {
    Relation r = resolve(relations, defaultSchema, name);
    if (r == null) throw new SchemaValidationException("Unknown relation: " + name);
    return r;
  }

  public Table table(String name) {
    Relation r = relation(name);
    if (!(r instanceof Table t)) throw new SchemaValidationException("Relation " + name + " is not a table");
    return t;
  }

  public View view(String name) {
    Relation r = relation(name);
    if (!(r instanceof View v)) throw new SchemaValidationException("Relation " + name + " is not a view");
    return v;
  }

  /** Associations whose parent is {@code parent} (reverse lookup of {@link Relation#associations()}). */
  public List<Association> incomingAssociations(Relation parent) {
    return incoming.getOrDefault(parent, List.of());
  }

  // qualified name first, then default-schema qualified, then a unique bare name
  private static Relation resolve(Map<String, Relation> relations, String defaultSchema, String name) {
    if (name == null || name.isBlank()) return null;
    String n = name.trim();
    Relation r = relations.get(n);
    if (r != null) return r;
    if (defaultSchema != null && !n.contains(".")) {
      r = relations.get(defaultSchema + "." + n);
      if (r != null) return r;
    }
    if (n.contains(".")) return null;
    Relation match = null;
    for (Relation candidate : relations.values()) {
      if (!candidate.name().equals(n)) continue;
      if (match != null) throw new SchemaValidationException("Relation name '" + n + "' is ambiguous; qualify it with a schema");
      match = candidate;
    }
    return match;
  }

  /** Collects relation declarations; associations may reference relations declared later or the relation itself. */
  public static final class Builder {
    private final List<RelationBuilder> declared = new ArrayList<>();
    private String defaultSchema;

    private Builder() {}

    public Builder defaultSchema(String schema) {
      this.defaultSchema = (schema == null || schema.isBlank()) ? null : schema.trim();
      return this;
    }

    public Builder table(String name, Consumer<RelationBuilder> definition) {
      return table(null, name, definition);
    }

    public Builder table(String schema, String name, Consumer<RelationBuilder> definition) {
      return declare(RelationBuilder.Kind.TABLE, schema, name, definition);
    }

    public Builder view(String name, Consumer<RelationBuilder> definition) {
      return view(null, name, definition);
    }

    public Builder view(String schema, String name, Consumer<RelationBuilder> definition) {
      return declare(RelationBuilder.Kind.VIEW, schema, name, definition);
    }

    private Builder declare(RelationBuilder.Kind kind, String schema, String name, Consumer<RelationBuilder> definition) {
      RelationBuilder rb = new RelationBuilder(kind, schema, name);
      if (definition != null) definition.accept(rb);
      declared.add(rb);
      return this;
    }

    public Schema build() {
      Map<String, Relation> relations = new LinkedHashMap<>();
      Map<Relation, RelationBuilder> sources = new LinkedHashMap<>();
      for (RelationBuilder rb : declared) {
        String schema = rb.schema != null ? rb.schema : defaultSchema;
        Relation r = rb.kind == RelationBuilder.Kind.VIEW
            ? new View(schema, rb.name, rb.columns, rb.primaryKey, rb.query)
            : new Table(schema, rb.name, rb.columns, rb.primaryKey);
        if (relations.put(r.qualifiedName(), r) != null) {
          throw new SchemaValidationException("Duplicate relation: " + r.qualifiedName());
        }
        sources.put(r, rb);
      }

      for (Map.Entry<Relation, RelationBuilder> e : sources.entrySet()) {
        Relation child = e.getKey();
        List<Association> bound = new ArrayList<>();
        for (RelationBuilder.Reference ref : e.getValue().references) {
          Relation parent = resolve(relations, defaultSchema, ref.parent());
          if (parent == null) {
            throw new SchemaValidationException("Unknown relation '" + ref.parent() + "' referenced from " +
                child.qualifiedName() + "." + ref.column());
          }
          Column parentColumn;
          if (ref.parentColumn() != null) {
            parentColumn = parent.column(ref.parentColumn());
          } else {
            parentColumn = parent.primaryKey().orElseThrow(() -> new SchemaValidationException(
                "Relation " + parent.qualifiedName() + " has no primary key; association from " +
                    child.qualifiedName() + "." + ref.column() + " needs an explicit parent column"));
          }
          Association a = new Association(child, child.column(ref.column()), parent, parentColumn,
              ref.onDelete(), ref.onUpdate());
          if (bound.contains(a)) throw new SchemaValidationException("Duplicate association: " + a);
          bound.add(a);
        }
        child.bindAssociations(bound);
      }
      return new Schema(defaultSchema, relations);
    }
  }

  /** Declaration of one relation: columns, primary key, outgoing references. */
  public static final class RelationBuilder {
    enum Kind { TABLE, VIEW }

    record Reference(String column, String parent, String parentColumn,
                     ForeignKeyAction onDelete, ForeignKeyAction onUpdate) {}

    private final Kind kind;
    private final String schema;
    private final String name;
    private final List<Column> columns = new ArrayList<>();
    private final List<Reference> references = new ArrayList<>();
    private String primaryKey;
    private String query;

    private RelationBuilder(Kind kind, String schema, String name) {
      this.kind = kind;
      this.schema = schema;
      this.name = name;
    }

    public RelationBuilder column(Column column) {
      columns.add(Objects.requireNonNull(column, "column"));
      return this;
    }

    public RelationBuilder column(String name, ColumnType type) {
      return column(Column.of(name, type));
    }

    /** Declares a non-null column and makes it the primary key. */
    public RelationBuilder id(String name, ColumnType type) {
      column(Column.of(name, type).notNull());
      return primaryKey(name);
    }

    public RelationBuilder primaryKey(String column) {
      this.primaryKey = column;
      return this;
    }

    /** Query text for views; ignored for tables. */
    public RelationBuilder query(String sql) {
      this.query = sql;
      return this;
    }

    /** References the parent's primary key; both actions default to {@link ForeignKeyAction#NO_ACTION}. */
    public RelationBuilder references(String column, String parent) {
      return references(column, parent, null, ForeignKeyAction.NO_ACTION, ForeignKeyAction.NO_ACTION);
    }

    public RelationBuilder references(String column, String parent, String parentColumn,
                                      ForeignKeyAction onDelete, ForeignKeyAction onUpdate) {
      if (column == null || column.isBlank()) throw new SchemaValidationException("reference column is blank in " + name);
      if (parent == null || parent.isBlank()) throw new SchemaValidationException("reference target is blank in " + name);
      references.add(new Reference(column, parent, parentColumn, onDelete, onUpdate));
      return this;
    }
  }
}
