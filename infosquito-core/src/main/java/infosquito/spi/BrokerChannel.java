package infosquito.spi;

import java.io.IOException;

/**
 * A broker channel: topology declaration, blocking consumption, settlement and publishing.
 *
 * <p>A channel is used by one thread at a time. The only exception is {@link #close()},
 * which may be called from another thread to end a blocked {@link #consume}.
 */
public interface BrokerChannel extends AutoCloseable {

    /**
     * Declares a topic exchange. Repeating the call with identical arguments is a no-op.
     *
     * @param exchange   exchange name
     * @param durable    whether the exchange survives broker restarts
     * @param autoDelete whether the exchange is removed once its last binding goes away
     * @throws IOException if the broker refuses the declaration
     */
    void declareTopicExchange(String exchange, boolean durable, boolean autoDelete) throws IOException;

    /**
     * Declares a queue. Repeating the call with identical arguments is a no-op.
     *
     * @param queue      queue name
     * @param durable    whether the queue survives broker restarts
     * @param exclusive  whether the queue is restricted to this connection
     * @param autoDelete whether the queue is removed once its last consumer goes away
     * @throws IOException if the broker refuses the declaration
     */
    void declareQueue(String queue, boolean durable, boolean exclusive, boolean autoDelete) throws IOException;

    /**
     * Binds a queue to an exchange with a routing key pattern.
     *
     * @param queue      queue name
     * @param exchange   exchange name
     * @param routingKey binding pattern, may contain topic wildcards
     * @throws IOException if the broker refuses the binding
     */
    void bindQueue(String queue, String exchange, String routingKey) throws IOException;

    /**
     * Subscribes to a queue with manual acknowledgment and hands every delivery to
     * {@code callback} on the calling thread, one at a time, in broker order.
     *
     * <p>Blocks until the subscription ends. It never returns normally while the
     * channel is open.
     *
     * @param queue    queue name
     * @param callback receives each delivery; an exception from it ends the subscription
     * @throws IOException          if the channel or connection shuts down, or the consumer is cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws Exception            whatever {@code callback} throws
     */
    void consume(String queue, DeliveryCallback callback) throws Exception;

    /**
     * Acknowledges a single delivery.
     *
     * @param deliveryTag the delivery to acknowledge
     * @throws IOException if the acknowledgment cannot be sent
     */
    void ack(long deliveryTag) throws IOException;

    /**
     * Rejects a single delivery.
     *
     * @param deliveryTag the delivery to reject
     * @param requeue     whether the broker should redeliver it
     * @throws IOException if the rejection cannot be sent
     */
    void reject(long deliveryTag, boolean requeue) throws IOException;

    /**
     * Publishes a message.
     *
     * @param exchange   exchange name
     * @param routingKey routing key
     * @param body       message body
     * @throws IOException if the message cannot be sent
     */
    void publish(String exchange, String routingKey, byte[] body) throws IOException;

    @Override
    void close() throws IOException;
}
