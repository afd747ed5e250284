package infosquito.spi;

/**
 * Observability hook for exporting notifier counters to a metrics backend.
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
     * Increments the count of successful broker connections.
     */
    void incrementConnectSuccess();

    /**
     * Increments the count of failed connection attempts.
     */
    void incrementConnectFailure();

    /**
     * Increments the count of subscriptions that ended with a failure and triggered a reconnect.
     */
    void incrementSubscriptionFailure();

    /**
     * Increments the count of acknowledged deliveries.
     */
    void incrementAcked();

    /**
     * Increments the count of deliveries rejected with requeue.
     */
    void incrementRequeued();

    /**
     * Increments the count of deliveries with no registered handler.
     */
    void incrementUnhandled();

    /**
     * Increments the count of pong replies published.
     */
    default void incrementPongPublished() {
    }

    /**
     * Records whether a subscription is currently active.
     *
     * @param connected {@code true} while subscribed
     */
    default void recordConnected(boolean connected) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementConnectSuccess() {
        }

        @Override
        public void incrementConnectFailure() {
        }

        @Override
        public void incrementSubscriptionFailure() {
        }

        @Override
        public void incrementAcked() {
        }

        @Override
        public void incrementRequeued() {
        }

        @Override
        public void incrementUnhandled() {
        }
    }
}
