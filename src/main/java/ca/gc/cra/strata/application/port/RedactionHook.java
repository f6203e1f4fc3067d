package ca.gc.cra.strata.application.port;

/**
 * <strong>What:</strong> Optional message transformation applied before a record is dispatched.
 * <p><strong>Failure:</strong> Fail-open. When {@link #process(String)} throws, loggers keep the original
 * message and count the failure under {@code logger.redaction.error}.</p>
 * <p><strong>Thread-safety:</strong> Invoked concurrently from producer threads; implementations must be
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RedactionHook {
  /**
   * Returns the message to log in place of {@code message}.
   *
   * @param message original message; never {@code null}
   * @return replacement message; {@code null} is treated as the original
   */
  String process(String message);

  /** Hook that returns every message unchanged. */
  RedactionHook NONE = message -> message;
}
