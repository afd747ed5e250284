package infosquito.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import infosquito.Delivery;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Consumer that buffers deliveries for a single reader thread.
 *
 * <p>The client's dispatch thread enqueues; {@link #nextDelivery()} blocks the reader
 * until a delivery arrives. Once the channel shuts down or the broker cancels the
 * consumer, every further {@link #nextDelivery()} call fails with {@link IOException}.
 */
final class BlockingConsumer extends DefaultConsumer {
  private static final Delivery POISON = new Delivery(-1, "", null);

  private final BlockingQueue<Delivery> queue = new LinkedBlockingQueue<>();
  private volatile IOException terminated;

  BlockingConsumer(Channel channel) {
    super(channel);
  }

  @Override
  public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
      byte[] body) {
    queue.add(new Delivery(envelope.getDeliveryTag(), envelope.getRoutingKey(), body));
  }

  @Override
  public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
    terminate(new IOException("AMQP channel shut down", sig));
  }

  @Override
  public void handleCancel(String consumerTag) {
    terminate(new IOException("Consumer " + consumerTag + " cancelled by broker"));
  }

  /**
   * Waits for the next delivery. Deliveries received before a shutdown are still
   * returned, in order, before the shutdown is reported.
   *
   * @return the next delivery
   * @throws IOException          if the channel shut down or the consumer was cancelled
   * @throws InterruptedException if the reader is interrupted while waiting
   */
  Delivery nextDelivery() throws IOException, InterruptedException {
    Delivery next = queue.take();
    if (next == POISON) {
      queue.add(POISON);
      throw new IOException(terminated.getMessage(), terminated.getCause());
    }
    return next;
  }

  private void terminate(IOException cause) {
    if (terminated == null) {
      terminated = cause;
      queue.add(POISON);
    }
  }
}
