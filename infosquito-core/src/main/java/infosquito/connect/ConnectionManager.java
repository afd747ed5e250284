package infosquito.connect;

import infosquito.spi.BrokerConnection;
import infosquito.spi.BrokerConnector;
import infosquito.spi.MetricsExporter;
import infosquito.util.Sleeper;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens broker connections, retrying transport failures with backoff until one succeeds.
 *
 * <p>Each call to {@link #connect(String)} walks a fresh backoff sequence, so a later
 * outage starts again from the initial delay. Failures other than {@link IOException}
 * are not retried and propagate to the caller.
 */
public final class ConnectionManager {
  private static final Logger logger = Logger.getLogger(ConnectionManager.class.getName());

  private final BrokerConnector connector;
  private final BackoffPolicy backoffPolicy;
  private final Sleeper sleeper;
  private final MetricsExporter metrics;

  public ConnectionManager(BrokerConnector connector, BackoffPolicy backoffPolicy,
      Sleeper sleeper, MetricsExporter metrics) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Connects to the broker, blocking until an attempt succeeds. Never gives up.
   *
   * @param uri the broker URI
   * @return an open connection
   */
  public BrokerConnection connect(String uri) {
    return connect(uri, () -> true);
  }

  /**
   * Connects to the broker, blocking until an attempt succeeds or {@code keepTrying}
   * returns {@code false}. {@code keepTrying} is checked before every attempt.
   *
   * @param uri        the broker URI
   * @param keepTrying whether another attempt should be made
   * @return an open connection
   * @throws CancellationException if {@code keepTrying} turned {@code false}
   */
  public BrokerConnection connect(String uri, BooleanSupplier keepTrying) {
    Objects.requireNonNull(uri, "uri");
    PrimitiveIterator.OfLong delays = backoffPolicy.delays().iterator();
    while (keepTrying.getAsBoolean()) {
      long delayMs = delays.nextLong();
      try {
        BrokerConnection connection = connector.connect(uri);
        metrics.incrementConnectSuccess();
        return connection;
      } catch (IOException e) {
        metrics.incrementConnectFailure();
        logger.log(Level.SEVERE, "unable to establish AMQP connection - trying again in "
            + delayMs + " milliseconds", e);
        sleeper.sleep(Duration.ofMillis(delayMs));
      }
    }
    throw new CancellationException("connection attempts cancelled");
  }
}
