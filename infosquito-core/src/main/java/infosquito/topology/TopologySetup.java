package infosquito.topology;

import infosquito.spi.BrokerChannel;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Declares the exchange and queue of a {@link Topology} and binds them together.
 *
 * <p>All declarations are idempotent on the broker, so this runs on every reconnect.
 */
public final class TopologySetup {
  private static final Logger logger = Logger.getLogger(TopologySetup.class.getName());

  private final Topology topology;

  public TopologySetup(Topology topology) {
    this.topology = Objects.requireNonNull(topology, "topology");
  }

  public Topology topology() {
    return topology;
  }

  /**
   * Declares the topic exchange, the queue, and one binding per routing key pattern.
   *
   * @param channel the channel to declare on
   * @throws IOException if the broker refuses any declaration
   */
  public void declareAndBind(BrokerChannel channel) throws IOException {
    channel.declareTopicExchange(topology.exchangeName(),
        topology.exchangeDurable(), topology.exchangeAutoDelete());
    channel.declareQueue(topology.queueName(),
        Topology.QUEUE_DURABLE, Topology.QUEUE_EXCLUSIVE, Topology.QUEUE_AUTO_DELETE);
    for (String key : topology.bindingKeys()) {
      channel.bindQueue(topology.queueName(), topology.exchangeName(), key);
    }
    logger.fine(() -> "Declared " + topology);
  }
}
