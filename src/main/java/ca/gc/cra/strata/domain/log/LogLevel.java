package ca.gc.cra.strata.domain.log;

import java.util.Locale;

/**
 * Severity levels understood by STRATA, ordered by numeric value.
 *
 * <p>Values match the conventional syslog-style ladder so thresholds configured as integers and as
 * names compare the same way.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  NOTSET(0),
  DEBUG(10),
  INFO(20),
  WARNING(30),
  ERROR(40),
  CRITICAL(50);

  private final int value;

  LogLevel(int value) {
    this.value = value;
  }

  /**
   * Returns the numeric severity used for threshold comparisons.
   *
   * @return level value; higher is more severe
   */
  public int value() {
    return value;
  }

  /**
   * Tests whether this level passes the given threshold.
   *
   * @param threshold minimum level a record must reach; must not be {@code null}
   * @return {@code true} when {@code this.value() >= threshold.value()}
   */
  public boolean isAtLeast(LogLevel threshold) {
    return value >= threshold.value;
  }

  /**
   * Parses a level name case-insensitively. {@code WARN} and {@code FATAL} are accepted as aliases.
   *
   * @param name level name; must not be blank
   * @return matching level
   * @throws IllegalArgumentException when the name is blank or unknown
   */
  public static LogLevel fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("level name must not be blank");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "WARN" -> WARNING;
      case "FATAL" -> CRITICAL;
      default -> {
        try {
          yield LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
          throw new IllegalArgumentException("Unknown log level: " + name, ex);
        }
      }
    };
  }

  /**
   * Maps a numeric value to the most severe level not exceeding it.
   *
   * @param value numeric level; negative values map to {@link #NOTSET}
   * @return matching level
   */
  public static LogLevel fromValue(int value) {
    LogLevel result = NOTSET;
    for (LogLevel level : values()) {
      if (level.value <= value) {
        result = level;
      }
    }
    return result;
  }
}
