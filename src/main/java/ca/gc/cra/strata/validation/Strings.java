package ca.gc.cra.strata.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> String validation utilities for STRATA configuration and component names.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character names for layers, sinks and loggers.</li>
 *   <li>Match enumerated option values (destination types, formats) case-insensitively.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isISOControl(trimmed.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    return trimmed;
  }

  /**
   * Normalizes a value to lower case and checks it against the allowed options.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate option
   * @param allowed permitted lower-case options
   * @return normalized option
   * @throws IllegalArgumentException if the value is blank or not one of {@code allowed}
   */
  public static String requireOneOf(String name, String value, Set<String> allowed) {
    String normalized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    if (!allowed.contains(normalized)) {
      throw new IllegalArgumentException(message(name, "must be one of " + allowed.stream().sorted().toList()
          + " (was " + value + ")"));
    }
    return normalized;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
