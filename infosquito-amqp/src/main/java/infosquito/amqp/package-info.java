/**
 * RabbitMQ implementation of the broker SPI, built on {@code com.rabbitmq:amqp-client}.
 *
 * <p>Use {@link infosquito.amqp.AmqpBrokerConnector} as the connector of an
 * {@link infosquito.Infosquito}.
 */
package infosquito.amqp;
