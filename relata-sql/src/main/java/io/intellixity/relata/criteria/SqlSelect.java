package io.intellixity.relata.criteria;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Rendered SELECT with its positional parameters, in placeholder order. */
public record SqlSelect(String sql, List<Object> params) {
  public SqlSelect {
    // params may hold nulls, so List.copyOf is not an option
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }
}
