package infosquito.amqp;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import infosquito.Delivery;
import infosquito.spi.BrokerChannel;
import infosquito.spi.DeliveryCallback;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerChannel} wrapping a RabbitMQ {@link Channel}.
 *
 * <p>{@link #consume(String, DeliveryCallback)} registers a manual-ack consumer and
 * runs the callback on the calling thread, one delivery at a time. Deliveries pushed
 * by the client's dispatch thread wait in a {@link BlockingConsumer} until the
 * previous one has been handled.
 */
public final class AmqpBrokerChannel implements BrokerChannel {
  private static final Logger logger = Logger.getLogger(AmqpBrokerChannel.class.getName());

  private final Channel channel;

  public AmqpBrokerChannel(Channel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  @Override
  public void declareTopicExchange(String exchange, boolean durable, boolean autoDelete) throws IOException {
    channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, durable, autoDelete, null);
  }

  @Override
  public void declareQueue(String queue, boolean durable, boolean exclusive, boolean autoDelete)
      throws IOException {
    channel.queueDeclare(queue, durable, exclusive, autoDelete, null);
  }

  @Override
  public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
    channel.queueBind(queue, exchange, routingKey);
  }

  @Override
  public void consume(String queue, DeliveryCallback callback) throws Exception {
    Objects.requireNonNull(callback, "callback");
    BlockingConsumer consumer = new BlockingConsumer(channel);
    String consumerTag = channel.basicConsume(queue, false, consumer);
    logger.fine(() -> "Consuming from " + queue + " as " + consumerTag);
    while (true) {
      Delivery delivery = consumer.nextDelivery();
      callback.handle(delivery);
    }
  }

  @Override
  public void ack(long deliveryTag) throws IOException {
    try {
      channel.basicAck(deliveryTag, false);
    } catch (AlreadyClosedException e) {
      throw new IOException("AMQP channel already closed", e);
    }
  }

  @Override
  public void reject(long deliveryTag, boolean requeue) throws IOException {
    try {
      channel.basicReject(deliveryTag, requeue);
    } catch (AlreadyClosedException e) {
      throw new IOException("AMQP channel already closed", e);
    }
  }

  @Override
  public void publish(String exchange, String routingKey, byte[] body) throws IOException {
    try {
      channel.basicPublish(exchange, routingKey, null, body);
    } catch (AlreadyClosedException e) {
      throw new IOException("AMQP channel already closed", e);
    }
  }

  @Override
  public void close() throws IOException {
    if (!channel.isOpen()) {
      return;
    }
    try {
      channel.close();
    } catch (AlreadyClosedException e) {
      logger.log(Level.FINE, "AMQP channel closed concurrently", e);
    } catch (TimeoutException e) {
      throw new IOException("Timed out closing AMQP channel", e);
    }
  }
}
