package ca.gc.cra.strata.application.dispatch;

/**
 * Point-in-time counters for an {@link AsyncDispatcher}.
 *
 * @param state lifecycle state
 * @param primaryDepth records waiting in the primary queue
 * @param overflowDepth records waiting in the overflow queue
 * @param inFlight records currently held by workers
 * @param enqueuedPrimary records ever accepted by the primary queue
 * @param enqueuedOverflow records ever accepted by the overflow queue
 * @param processed records handed to the consumer without error
 * @param workerErrors records whose delivery threw
 * @param dropped records refused or discarded
 * @param workers worker thread count
 * @param permits semaphore permit count
 * @since 0.1.0
 */
public record DispatcherStats(
    DispatcherState state,
    int primaryDepth,
    int overflowDepth,
    int inFlight,
    long enqueuedPrimary,
    long enqueuedOverflow,
    long processed,
    long workerErrors,
    long dropped,
    int workers,
    int permits) {}
