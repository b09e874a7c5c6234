package io.intellixity.relata.util;

import io.intellixity.relata.RelataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Instantiates the implementations of an SPI named in every {@code META-INF/relata.factories} on the classpath.
 *
 * A factories file is a Properties file mapping SPI interface name to comma-separated class names, e.g.
 * {@code io.intellixity.relata.sql.Dialect=io.intellixity.relata.postgres.PostgresDialect}.
 * Implementations keep classpath order; a class listed twice is created once, attributed to the first
 * file that names it. Failures report that file.
 */
public final class RelataFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(RelataFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/relata.factories";

  /** One class name and the factories file that declared it. */
  record Declaration(String className, URL source) {}

  private RelataFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader classLoader) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader cl = classLoader != null ? classLoader : RelataFactoriesLoader.class.getClassLoader();

    List<T> out = new ArrayList<>();
    for (Declaration d : declarations(spiType.getName(), cl)) {
      out.add(instantiate(d, spiType, cl));
    }
    log.debug("relata.factories spi={} implementations={}", spiType.getName(), out.size());
    return out;
  }

  static Collection<Declaration> declarations(String spiName, ClassLoader cl) {
    Map<String, Declaration> byClass = new LinkedHashMap<>();
    for (URL source : resources(cl)) {
      String listed = read(source).getProperty(spiName);
      if (listed == null) continue;
      for (String part : listed.split(",")) {
        String className = part.trim();
        if (!className.isEmpty()) byClass.putIfAbsent(className, new Declaration(className, source));
      }
    }
    return byClass.values();
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new RelataException("Cannot list " + RESOURCE + " resources", e);
    }
  }

  private static Properties read(URL source) {
    Properties p = new Properties();
    try (InputStream in = source.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new RelataException("Cannot read " + source, e);
    }
    return p;
  }

  private static <T> T instantiate(Declaration d, Class<T> spiType, ClassLoader cl) {
    String where = " (declared in " + d.source() + ")";
    Class<?> type;
    try {
      type = Class.forName(d.className(), true, cl);
    } catch (ClassNotFoundException e) {
      throw new RelataException("No class " + d.className() + " for " + spiType.getSimpleName() + where, e);
    }
    if (!spiType.isAssignableFrom(type)) {
      throw new RelataException(d.className() + " does not implement " + spiType.getName() + where);
    }
    try {
      return spiType.cast(type.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new RelataException("Cannot create " + d.className() + " via its no-arg constructor" + where, e);
    }
  }
}
