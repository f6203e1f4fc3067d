package ca.gc.cra.strata.application.logger;

/**
 * Lifecycle of a {@link LayeredLogger}: {@code UNINITIALIZED -> INITIALIZED -> CLOSING -> CLOSED}.
 * Log calls are accepted only while {@link #INITIALIZED}.
 *
 * @since 0.1.0
 */
public enum LoggerState {
  UNINITIALIZED,
  INITIALIZED,
  CLOSING,
  CLOSED
}
