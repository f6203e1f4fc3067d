package ca.gc.cra.strata.domain.log;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Source location attached to a {@link LogRecord}.
 *
 * @param file source file name, or {@code "unknown"}
 * @param function method name, or {@code "unknown"}
 * @param line line number; {@code 0} when unavailable
 * @since 0.1.0
 */
public record CallerContext(String file, String function, int line) {
  private static final String UNKNOWN = "unknown";
  private static final StackWalker WALKER = StackWalker.getInstance();

  /**
   * Normalizes missing values to {@code "unknown"} and negative lines to zero.
   */
  public CallerContext {
    file = (file == null || file.isBlank()) ? UNKNOWN : file;
    function = (function == null || function.isBlank()) ? UNKNOWN : function;
    line = Math.max(0, line);
  }

  /**
   * Inspects the current stack for the first frame outside the supplied classes.
   *
   * <p>Walking the stack costs far more than building a record; callers opt in explicitly.</p>
   *
   * @param skippedClassNames fully-qualified names of logging infrastructure frames to skip
   * @return caller location, or empty when every frame was skipped
   */
  public static Optional<CallerContext> capture(Set<String> skippedClassNames) {
    Objects.requireNonNull(skippedClassNames, "skippedClassNames");
    return WALKER.walk(frames -> frames
        .filter(frame -> !frame.getClassName().equals(CallerContext.class.getName()))
        .filter(frame -> !skippedClassNames.contains(frame.getClassName()))
        .findFirst()
        .map(frame -> new CallerContext(frame.getFileName(), frame.getMethodName(), frame.getLineNumber())));
  }
}
