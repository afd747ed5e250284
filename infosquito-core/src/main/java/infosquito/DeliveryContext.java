package infosquito;

import infosquito.spi.BrokerChannel;
import infosquito.spi.MetricsExporter;

import java.io.IOException;
import java.util.Objects;

/**
 * Settlement and publishing operations for one delivery, bound to the channel that
 * delivered it.
 *
 * <p>A delivery is settled at most once: after {@link #ack()} or {@link #reject(boolean)}
 * succeeds, further settlement calls are rejected with {@link IllegalStateException}.
 * Publishing goes to the exchange the notifier consumes from.
 *
 * <p>Instances are created by the dispatcher and are only valid while the handler runs.
 */
public final class DeliveryContext {
  private final Delivery delivery;
  private final BrokerChannel channel;
  private final String exchange;
  private final MetricsExporter metrics;
  private boolean settled;

  public DeliveryContext(Delivery delivery, BrokerChannel channel, String exchange,
      MetricsExporter metrics) {
    this.delivery = Objects.requireNonNull(delivery, "delivery");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.exchange = Objects.requireNonNull(exchange, "exchange");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Acknowledges the delivery, removing it from the queue.
   *
   * @throws IOException           if the acknowledgment cannot be sent
   * @throws IllegalStateException if the delivery was already settled
   */
  public void ack() throws IOException {
    ensureUnsettled();
    channel.ack(delivery.deliveryTag());
    settled = true;
    metrics.incrementAcked();
  }

  /**
   * Rejects the delivery.
   *
   * @param requeue whether the broker should redeliver it
   * @throws IOException           if the rejection cannot be sent
   * @throws IllegalStateException if the delivery was already settled
   */
  public void reject(boolean requeue) throws IOException {
    ensureUnsettled();
    channel.reject(delivery.deliveryTag(), requeue);
    settled = true;
    if (requeue) {
      metrics.incrementRequeued();
    }
  }

  /**
   * Publishes a message to the notifier's exchange.
   *
   * @param routingKey routing key of the outgoing message
   * @param body       message body
   * @throws IOException if the message cannot be sent
   */
  public void publish(String routingKey, byte[] body) throws IOException {
    channel.publish(exchange, Objects.requireNonNull(routingKey, "routingKey"),
        Objects.requireNonNull(body, "body"));
  }

  public boolean isSettled() {
    return settled;
  }

  public Delivery delivery() {
    return delivery;
  }

  public String exchange() {
    return exchange;
  }

  private void ensureUnsettled() {
    if (settled) {
      throw new IllegalStateException("Delivery already settled: deliveryTag=" + delivery.deliveryTag());
    }
  }
}
