package io.intellixity.relata.criteria;

import java.util.HashSet;
import java.util.Set;

/**
 * Alias counter for one query compilation. Never shared between queries.
 */
public final class RenderContext {
  private final Set<String> taken = new HashSet<>();
  private int n = 0;

  /** Marks an explicit alias as used so generated ones skip it. */
  public void reserve(String alias) {
    taken.add(alias);
  }

  /** Next {@code base_N} not reserved in this context. */
  public String uniqueAlias(String base) {
    String candidate;
    do {
      candidate = base + "_" + (++n);
    } while (!taken.add(candidate));
    return candidate;
  }
}
