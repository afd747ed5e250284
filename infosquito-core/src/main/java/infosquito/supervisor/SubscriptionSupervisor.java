package infosquito.supervisor;

import infosquito.connect.ConnectionManager;
import infosquito.dispatch.MessageDispatcher;
import infosquito.spi.BrokerChannel;
import infosquito.spi.BrokerConnection;
import infosquito.spi.MetricsExporter;
import infosquito.topology.TopologySetup;
import infosquito.util.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Top-level control loop owning the broker connection and channel.
 *
 * <p>Each cycle connects (retrying with backoff), opens a channel, declares the
 * topology and blocks in the subscription, dispatching deliveries one at a time. When
 * anything in the cycle fails, the channel and connection are closed, the loop pauses
 * for the fixed reconnect delay, and a new cycle starts. Unchecked exceptions from the
 * connector or a handler are treated the same way. {@link #run()} only returns after
 * {@link #close()}.
 *
 * <p>The connection and channel of a cycle are never shared: they are opened and
 * closed by the thread running the loop. {@link #close()} may be called from any
 * thread; it closes the active channel and connection to unblock the subscription.
 */
public final class SubscriptionSupervisor implements Runnable, AutoCloseable {
  private static final Logger logger = Logger.getLogger(SubscriptionSupervisor.class.getName());

  private final ConnectionManager connectionManager;
  private final TopologySetup topologySetup;
  private final MessageDispatcher dispatcher;
  private final String uri;
  private final Duration reconnectDelay;
  private final Sleeper sleeper;
  private final MetricsExporter metrics;

  private volatile boolean running = true;
  private volatile SupervisorState state = SupervisorState.DISCONNECTED;
  private volatile BrokerConnection activeConnection;
  private volatile BrokerChannel activeChannel;
  private volatile Thread runner;

  public SubscriptionSupervisor(ConnectionManager connectionManager, TopologySetup topologySetup,
      MessageDispatcher dispatcher, String uri, Duration reconnectDelay, Sleeper sleeper,
      MetricsExporter metrics) {
    this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    this.topologySetup = Objects.requireNonNull(topologySetup, "topologySetup");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.uri = Objects.requireNonNull(uri, "uri");
    this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
    if (reconnectDelay.isNegative()) {
      throw new IllegalArgumentException("reconnectDelay must not be negative");
    }
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Runs connect/subscribe cycles on the calling thread until {@link #close()} is called.
   *
   * @throws IllegalStateException if the loop is already running or was closed
   */
  @Override
  public void run() {
    synchronized (this) {
      if (!running) {
        throw new IllegalStateException("SubscriptionSupervisor has been closed");
      }
      if (runner != null) {
        throw new IllegalStateException("SubscriptionSupervisor is already running");
      }
      runner = Thread.currentThread();
    }
    try {
      while (running) {
        try {
          runCycle();
        } catch (VirtualMachineError e) {
          throw e;
        } catch (RuntimeException | Error e) {
          // a faulty connector or handler must not end the loop
          if (running) {
            metrics.incrementSubscriptionFailure();
            logger.log(Level.SEVERE, "unexpected failure in AMQP subscription - reconnecting in "
                + reconnectDelay.toMillis() + " milliseconds", e);
          }
        }
        if (running) {
          sleeper.sleep(reconnectDelay);
        }
      }
    } finally {
      state = SupervisorState.STOPPED;
      runner = null;
    }
  }

  private void runCycle() {
    state = SupervisorState.CONNECTING;
    BrokerConnection connection;
    try {
      connection = connectionManager.connect(uri, () -> running);
    } catch (CancellationException e) {
      return;
    }
    activeConnection = connection;
    if (!running) {
      // close() ran between the successful attempt and the hand-off
      closeQuietly(connection, "connection");
      return;
    }
    logger.info("successfully connected to AMQP broker");
    try {
      subscribe(connection);
    } catch (Exception e) {
      if (running) {
        metrics.incrementSubscriptionFailure();
        logger.log(Level.SEVERE, "reconnecting to AMQP in " + reconnectDelay.toMillis()
            + " milliseconds", e);
      }
    } finally {
      state = SupervisorState.TEARING_DOWN;
      activeConnection = null;
      closeQuietly(connection, "connection");
      state = SupervisorState.DISCONNECTED;
    }
  }

  private void subscribe(BrokerConnection connection) throws Exception {
    BrokerChannel channel = connection.openChannel();
    activeChannel = channel;
    try {
      topologySetup.declareAndBind(channel);
      state = SupervisorState.SUBSCRIBED;
      metrics.recordConnected(true);
      channel.consume(topologySetup.topology().queueName(),
          delivery -> dispatcher.route(delivery, channel));
    } catch (InterruptedException e) {
      if (!running) {
        Thread.currentThread().interrupt();
        return;
      }
      metrics.incrementSubscriptionFailure();
      logger.log(Level.WARNING, "subscription interrupted", e);
    } catch (Exception e) {
      if (running) {
        metrics.incrementSubscriptionFailure();
        logger.log(Level.SEVERE, "error occurred during message processing", e);
      }
    } finally {
      metrics.recordConnected(false);
      state = SupervisorState.TEARING_DOWN;
      activeChannel = null;
      closeQuietly(channel, "channel");
    }
  }

  public SupervisorState state() {
    return state;
  }

  public boolean isRunning() {
    return running && runner != null;
  }

  public boolean isClosed() {
    return !running;
  }

  /**
   * Stops the loop. Closes the active channel and connection, which ends a blocked
   * subscription, and interrupts a pending pause. Idempotent.
   */
  @Override
  public void close() {
    Thread current;
    synchronized (this) {
      running = false;
      current = runner;
    }
    BrokerChannel channel = activeChannel;
    if (channel != null) {
      closeQuietly(channel, "channel");
    }
    BrokerConnection connection = activeConnection;
    if (connection != null) {
      closeQuietly(connection, "connection");
    }
    if (current != null && current != Thread.currentThread()) {
      current.interrupt();
    }
    if (current == null) {
      state = SupervisorState.STOPPED;
    }
  }

  private static void closeQuietly(AutoCloseable closeable, String what) {
    try {
      closeable.close();
    } catch (Exception e) {
      logger.log(Level.FINE, "Ignoring failure while closing AMQP " + what, e);
    }
  }
}
