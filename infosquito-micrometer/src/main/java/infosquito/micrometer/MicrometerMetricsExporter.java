package infosquito.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import infosquito.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code infosquito.connect.success} - broker connections established</li>
 *   <li>{@code infosquito.connect.failure} - failed connection attempts (retried with backoff)</li>
 *   <li>{@code infosquito.subscription.failure} - subscriptions torn down by an error</li>
 *   <li>{@code infosquito.delivery.acked} - deliveries acknowledged</li>
 *   <li>{@code infosquito.delivery.requeued} - deliveries rejected with requeue</li>
 *   <li>{@code infosquito.delivery.unhandled} - deliveries with no handler for their routing key</li>
 *   <li>{@code infosquito.pong.published} - ping replies sent</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code infosquito.connected} - 1 while a subscription is active, else 0</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter connectSuccess;
  private final Counter connectFailure;
  private final Counter subscriptionFailure;
  private final Counter acked;
  private final Counter requeued;
  private final Counter unhandled;
  private final Counter pongPublished;
  private final Gauge connectedGauge;

  private final AtomicInteger connected = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "infosquito"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "infosquito");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several
   * notifiers in one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "search.infosquito"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.connectSuccess = Counter.builder(namePrefix + ".connect.success")
        .description("Broker connections established")
        .register(registry);
    this.connectFailure = Counter.builder(namePrefix + ".connect.failure")
        .description("Failed broker connection attempts")
        .register(registry);
    this.subscriptionFailure = Counter.builder(namePrefix + ".subscription.failure")
        .description("Subscriptions torn down by an error")
        .register(registry);
    this.acked = Counter.builder(namePrefix + ".delivery.acked")
        .description("Deliveries acknowledged")
        .register(registry);
    this.requeued = Counter.builder(namePrefix + ".delivery.requeued")
        .description("Deliveries rejected with requeue")
        .register(registry);
    this.unhandled = Counter.builder(namePrefix + ".delivery.unhandled")
        .description("Deliveries without a handler for their routing key")
        .register(registry);
    this.pongPublished = Counter.builder(namePrefix + ".pong.published")
        .description("Ping replies published")
        .register(registry);

    this.connectedGauge = Gauge.builder(namePrefix + ".connected", connected, AtomicInteger::get)
        .description("1 while subscribed to the broker")
        .register(registry);
  }

  @Override
  public void incrementConnectSuccess() {
    if (closed) return;
    connectSuccess.increment();
  }

  @Override
  public void incrementConnectFailure() {
    if (closed) return;
    connectFailure.increment();
  }

  @Override
  public void incrementSubscriptionFailure() {
    if (closed) return;
    subscriptionFailure.increment();
  }

  @Override
  public void incrementAcked() {
    if (closed) return;
    acked.increment();
  }

  @Override
  public void incrementRequeued() {
    if (closed) return;
    requeued.increment();
  }

  @Override
  public void incrementUnhandled() {
    if (closed) return;
    unhandled.increment();
  }

  @Override
  public void incrementPongPublished() {
    if (closed) return;
    pongPublished.increment();
  }

  @Override
  public void recordConnected(boolean connected) {
    if (closed) return;
    this.connected.set(connected ? 1 : 0);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link infosquito.Infosquito#close()} calls this when the exporter was passed
   * to its builder.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(connectSuccess, connectFailure, subscriptionFailure,
        acked, requeued, unhandled, pongPublished, connectedGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
