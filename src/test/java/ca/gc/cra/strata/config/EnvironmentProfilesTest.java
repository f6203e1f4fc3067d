package ca.gc.cra.strata.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.strata.domain.log.LogLevel;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentProfilesTest {

  @Test
  void noVariablesGiveDefaults() {
    assertEquals(LoggingSettings.defaults(), EnvironmentProfiles.fromEnvironment(Map.of()));
  }

  @Test
  void productionIsAsyncWithConsoleAndJsonFile() {
    LoggingSettings settings = EnvironmentProfiles.fromEnvironment(Map.of("STRATA_ENV", "Production"));

    assertEquals(LoggingSettings.Mode.ASYNC, settings.mode());
    LayerSettings layer = settings.layer("default").orElseThrow();
    assertEquals(2, layer.destinations().size());
    assertEquals(LogLevel.WARNING, layer.destinations().get(0).level());
    DestinationSettings file = layer.destinations().get(1);
    assertEquals(DestinationSettings.JSON, file.format());
    assertEquals(Path.of("logs", "app.log"), file.path());
  }

  @Test
  void developmentLogsDebugToConsole() {
    LoggingSettings settings = EnvironmentProfiles.fromEnvironment(Map.of("STRATA_ENV", "dev"));

    assertEquals(LoggingSettings.Mode.SYNC, settings.mode());
    assertEquals(LogLevel.DEBUG, settings.layer("default").orElseThrow().level());
  }

  @Test
  void testProfileDiscards() {
    LoggingSettings settings = EnvironmentProfiles.fromEnvironment(Map.of("STRATA_ENV", "test"));

    assertEquals(DestinationSettings.NULL, settings.layer("default").orElseThrow().destinations().get(0).type());
  }

  @Test
  void levelAndDirectoryOverridesApply() {
    LoggingSettings settings = EnvironmentProfiles.fromEnvironment(Map.of(
        "STRATA_ENV", "production",
        "STRATA_LEVEL", "error",
        "STRATA_LOG_DIR", "/srv/logs"));

    LayerSettings layer = settings.layer("default").orElseThrow();
    assertEquals(LogLevel.ERROR, layer.level());
    assertEquals(Path.of("/srv/logs", "app.log"), layer.destinations().get(1).path());
  }

  @Test
  void unknownLevelIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> EnvironmentProfiles.fromEnvironment(Map.of("STRATA_LEVEL", "chatty")));
  }
}
