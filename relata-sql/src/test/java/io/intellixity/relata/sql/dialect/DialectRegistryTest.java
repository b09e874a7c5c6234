package io.intellixity.relata.sql.dialect;

import io.intellixity.relata.sql.Dialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DialectRegistryTest {
  @AfterEach
  void clearProperty() {
    System.clearProperty(DialectRegistry.PROPERTY);
  }

  @Test
  void discoversAnsiFromFactories() {
    DialectRegistry r = new DialectRegistry();
    assertTrue(r.ids().contains("ansi"));
    assertInstanceOf(AnsiDialect.class, r.get("ANSI"));
  }

  @Test
  void defaultDialectFollowsSystemProperty() {
    DialectRegistry r = new DialectRegistry(List.of(new AnsiDialect(), new UpperDialect()));
    assertEquals("ansi", r.defaultDialect().id());

    System.setProperty(DialectRegistry.PROPERTY, "upper");
    assertInstanceOf(UpperDialect.class, r.defaultDialect());

    System.setProperty(DialectRegistry.PROPERTY, "missing");
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, r::defaultDialect);
    assertTrue(ex.getMessage().contains("Unknown dialect 'missing'"));
  }

  @Test
  void ansiIsAlwaysAvailableAndFirstRegistrationWins() {
    DialectRegistry r = new DialectRegistry(List.of(new UpperDialect(), new OtherUpperDialect()));
    assertInstanceOf(AnsiDialect.class, r.get("ansi"));
    assertInstanceOf(UpperDialect.class, r.get("upper"));
    assertTrue(r.find(null).isEmpty());
    assertTrue(r.find("nope").isEmpty());
  }

  static class UpperDialect extends AbstractSqlDialect {
    @Override public String id() { return "upper"; }
    @Override public String quoteIdent(String ident) { return ident.toUpperCase(); }
  }

  static final class OtherUpperDialect extends UpperDialect {
  }

  @Test
  void registryDialectsImplementTheSpi() {
    for (String id : new DialectRegistry().ids()) {
      Dialect d = new DialectRegistry().get(id);
      assertEquals(id, d.id());
    }
  }
}
