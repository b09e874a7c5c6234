package io.intellixity.relata.sql.dialect;

import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.util.RelataFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Dialects discovered via {@code META-INF/relata.factories}, by id.
 *
 * The default dialect is named by the {@value #PROPERTY} system property, falling back to {@value #DEFAULT_ID}.
 * {@link AnsiDialect} is always available.
 */
public final class DialectRegistry {
  private static final Logger log = LoggerFactory.getLogger(DialectRegistry.class);

  public static final String PROPERTY = "relata.dialect";
  public static final String DEFAULT_ID = AnsiDialect.ID;

  private final Map<String, Dialect> byId;

  public DialectRegistry() {
    this(RelataFactoriesLoader.load(Dialect.class));
  }

  public DialectRegistry(List<Dialect> dialects) {
    Map<String, Dialect> m = new LinkedHashMap<>();
    for (Dialect d : dialects == null ? List.<Dialect>of() : dialects) {
      if (d == null) continue;
      String id = normalize(d.id());
      Dialect prev = m.putIfAbsent(id, d);
      if (prev != null && prev.getClass() != d.getClass()) {
        log.warn("relata.dialect duplicate id={} kept={} ignored={}", id, prev.getClass().getName(), d.getClass().getName());
      }
    }
    m.putIfAbsent(AnsiDialect.ID, new AnsiDialect());
    this.byId = Collections.unmodifiableMap(m);
  }

  public Optional<Dialect> find(String id) {
    if (id == null || id.isBlank()) return Optional.empty();
    return Optional.ofNullable(byId.get(normalize(id)));
  }

  public Dialect get(String id) {
    return find(id).orElseThrow(() -> new IllegalArgumentException(
        "Unknown dialect '" + id + "'; available: " + byId.keySet()));
  }

  public Set<String> ids() { return byId.keySet(); }

  public Dialect defaultDialect() {
    String id = System.getProperty(PROPERTY, DEFAULT_ID);
    Dialect d = get(id);
    log.debug("relata.dialect default id={} impl={}", id, d.getClass().getName());
    return d;
  }

  private static String normalize(String id) {
    return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
  }
}
