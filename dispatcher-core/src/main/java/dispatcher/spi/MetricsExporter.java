package dispatcher.spi;

/**
 * Observability hook for exporting dispatcher counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of completed dispatch calls.
     */
    void incrementDispatched();

    /**
     * Increments the count of subscriber invocations that returned normally.
     */
    void incrementSubscriberSuccess();

    /**
     * Increments the count of subscriber invocations that threw.
     */
    void incrementSubscriberFailure();

    /**
     * Adds to the count of one-shot subscriptions removed after firing.
     *
     * @param count number of subscriptions retired by one dispatch pass
     */
    void incrementSubscriptionsRetired(int count);

    /**
     * Records the number of subscriptions currently registered across all events.
     *
     * @param count active subscription count
     */
    void recordActiveSubscriptions(int count);

    /**
     * Records the wall-clock time of one dispatch call.
     *
     * @param durationMs dispatch duration in milliseconds (always non-negative)
     */
    default void recordDispatchDurationMs(long durationMs) {
    }

    /**
     * Records the time spent inside a single subscriber.
     *
     * @param durationMs subscriber execution time in milliseconds (always non-negative)
     */
    default void recordSubscriberDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatched() {
        }

        @Override
        public void incrementSubscriberSuccess() {
        }

        @Override
        public void incrementSubscriberFailure() {
        }

        @Override
        public void incrementSubscriptionsRetired(int count) {
        }

        @Override
        public void recordActiveSubscriptions(int count) {
        }
    }
}
