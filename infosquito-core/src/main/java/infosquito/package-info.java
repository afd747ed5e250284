/**
 * Root API for infosquito, a message-triggered reindexing notifier.
 *
 * <h2>Core Design</h2>
 * <p>A single consumer subscribes to a durable queue bound to a topic exchange with
 * {@code index.all}, {@code index.data} and {@code events.infosquito.#}. Each delivery
 * is routed by its literal routing key to a {@link infosquito.MessageHandler}:
 * reindex requests run the {@link infosquito.ReindexAction} and are acknowledged on
 * success or requeued after a pause on failure; pings are acknowledged and answered
 * with a pong. Delivery is at-least-once and strictly sequential.
 *
 * <p>The {@linkplain infosquito.supervisor.SubscriptionSupervisor supervisor} owns the
 * connection. Connection attempts back off exponentially from 5 s to 320 s; any failure
 * during a subscription tears down the channel and connection, and the loop reconnects.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>infosquito-core</b> - engine, handlers and SPIs (zero external deps)</li>
 *   <li><b>infosquito-amqp</b> - RabbitMQ broker client</li>
 *   <li><b>infosquito-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>infosquito-spring-boot-starter</b> - Spring Boot auto-configuration</li>
 * </ul>
 *
 * @see infosquito.Infosquito
 * @see infosquito.MessageHandler
 * @see infosquito.ReindexAction
 */
package infosquito;
