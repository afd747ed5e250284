package infosquito.handler;

import infosquito.Delivery;
import infosquito.DeliveryContext;
import infosquito.HandlerOutcome;
import infosquito.MessageHandler;
import infosquito.RoutingKeys;
import infosquito.spi.MetricsExporter;
import infosquito.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Answers {@code events.infosquito.ping} health checks with a pong message.
 *
 * <p>The ping is acknowledged before anything else happens, so it is never
 * redelivered. The pong goes to the same exchange with routing key
 * {@code events.infosquito.pong}. A publish failure is not caught here: it ends the
 * subscription and triggers a reconnect.
 */
public final class PingHandler implements MessageHandler {
  private static final Logger logger = Logger.getLogger(PingHandler.class.getName());

  public static final String PONG_FROM = "infosquito";

  private static final byte[] PONG_BODY = JsonCodec.toJson(Map.of("pong_from", PONG_FROM))
      .getBytes(StandardCharsets.UTF_8);

  private final MetricsExporter metrics;

  public PingHandler() {
    this(MetricsExporter.NOOP);
  }

  public PingHandler(MetricsExporter metrics) {
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Returns the serialized pong reply.
   *
   * @return a copy of the UTF-8 encoded {@code {"pong_from":"infosquito"}} body
   */
  public static byte[] pongBody() {
    return PONG_BODY.clone();
  }

  @Override
  public HandlerOutcome process(Delivery delivery, DeliveryContext context) throws IOException {
    context.ack();
    logger.info(String.format("[events/ping-handler] [%s] [%s]",
        delivery.routingKey(), delivery.bodyAsString()));
    context.publish(RoutingKeys.PONG, pongBody());
    metrics.incrementPongPublished();
    return HandlerOutcome.ACK;
  }
}
