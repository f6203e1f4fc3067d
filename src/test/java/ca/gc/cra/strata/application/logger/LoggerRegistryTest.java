package ca.gc.cra.strata.application.logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.application.routing.LayerConfiguration;
import ca.gc.cra.strata.application.routing.LayerRouter;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LoggerRegistryTest {

  @Test
  void getOrCreateBuildsEachNameOnce() {
    AtomicInteger created = new AtomicInteger();
    try (LoggerRegistry registry = new LoggerRegistry()) {
      LayeredLogger first = registry.getOrCreate("svc", name -> {
        created.incrementAndGet();
        return logger(name);
      });
      LayeredLogger second = registry.getOrCreate("svc", name -> {
        created.incrementAndGet();
        return logger(name);
      });

      assertSame(first, second);
      assertEquals(1, created.get());
      assertTrue(registry.contains("svc"));
      assertEquals(List.of("svc"), registry.names());
    }
  }

  @Test
  void removeClosesLogger() {
    LoggerRegistry registry = new LoggerRegistry();
    LayeredLogger logger = registry.getOrCreate("svc", LoggerRegistryTest::logger);

    assertTrue(registry.remove("svc"));
    assertFalse(registry.remove("svc"));
    assertEquals(LoggerState.CLOSED, logger.state());
    assertTrue(registry.find("svc").isEmpty());
    registry.close();
  }

  @Test
  void closeClosesAllAndRefusesNewLoggers() {
    LoggerRegistry registry = new LoggerRegistry();
    LayeredLogger a = registry.getOrCreate("a", LoggerRegistryTest::logger);
    LayeredLogger b = registry.getOrCreate("b", LoggerRegistryTest::logger);

    registry.close();

    assertEquals(0, registry.size());
    assertEquals(LoggerState.CLOSED, a.state());
    assertEquals(LoggerState.CLOSED, b.state());
    assertThrows(IllegalStateException.class, () -> registry.getOrCreate("c", LoggerRegistryTest::logger));
  }

  @Test
  void blankNamesAreRejected() {
    try (LoggerRegistry registry = new LoggerRegistry()) {
      assertThrows(IllegalArgumentException.class, () -> registry.getOrCreate(" ", LoggerRegistryTest::logger));
    }
  }

  private static LayeredLogger logger(String name) {
    return new SyncLayeredLogger(LoggerOptions.named(name), new LayerRouter(LayerConfiguration.empty())).initialize();
  }
}
