package io.intellixity.relata.sql;

import io.intellixity.relata.node.RelationNode;
import io.intellixity.relata.projection.Projection;

import java.util.List;
import java.util.Objects;

/** Shape of a SELECT handed to {@link Dialect#select(SelectModel)}. */
public record SelectModel(
    List<Projection> projections,
    RelationNode from,
    /** Restrictions, AND-ed together. */
    List<String> where,
    List<String> orderBy,
    /** Null when unbounded. */
    Integer limit,
    /** Null when not skipping rows. */
    Integer offset
) {
  public SelectModel {
    Objects.requireNonNull(from, "from");
    projections = projections == null ? List.of() : List.copyOf(projections);
    where = where == null ? List.of() : List.copyOf(where);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }
}
