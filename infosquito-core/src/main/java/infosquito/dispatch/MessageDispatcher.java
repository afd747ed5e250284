package infosquito.dispatch;

import infosquito.Delivery;
import infosquito.DeliveryContext;
import infosquito.HandlerOutcome;
import infosquito.MessageHandler;
import infosquito.registry.HandlerRegistry;
import infosquito.spi.BrokerChannel;
import infosquito.spi.MetricsExporter;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Routes each delivery to the handler registered for its routing key and settles it
 * according to the handler's {@link HandlerOutcome}.
 *
 * <p>Deliveries run one at a time on the calling thread. A delivery whose routing key
 * has no handler is dropped without being acknowledged or rejected: it stays unacked
 * on the channel until the channel closes, at which point the broker requeues it.
 *
 * <p>Exceptions thrown by handlers, and settlement failures, propagate to the caller.
 *
 * @see HandlerRegistry
 * @see RequeuePolicy
 */
public final class MessageDispatcher {
  private static final Logger logger = Logger.getLogger(MessageDispatcher.class.getName());

  private final HandlerRegistry handlerRegistry;
  private final RequeuePolicy requeuePolicy;
  private final String exchange;
  private final MetricsExporter metrics;

  public MessageDispatcher(HandlerRegistry handlerRegistry, RequeuePolicy requeuePolicy,
      String exchange, MetricsExporter metrics) {
    this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry");
    this.requeuePolicy = Objects.requireNonNull(requeuePolicy, "requeuePolicy");
    this.exchange = Objects.requireNonNull(exchange, "exchange");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Dispatches one delivery received on {@code channel}.
   *
   * @param delivery the delivery
   * @param channel  the channel it arrived on, used for settlement and replies
   * @return the outcome applied; {@link HandlerOutcome#IGNORE} when no handler matched
   * @throws Exception whatever the handler or the settlement throws
   */
  public HandlerOutcome route(Delivery delivery, BrokerChannel channel) throws Exception {
    MessageHandler handler = handlerRegistry.handlerFor(delivery.routingKey());
    if (handler == null) {
      // TODO: decide whether unhandled deliveries should be rejected without requeue
      metrics.incrementUnhandled();
      logger.fine(() -> "No handler for routingKey=" + delivery.routingKey()
          + ", leaving deliveryTag=" + delivery.deliveryTag() + " unsettled");
      return HandlerOutcome.IGNORE;
    }

    DeliveryContext context = new DeliveryContext(delivery, channel, exchange, metrics);
    HandlerOutcome outcome = handler.process(delivery, context);
    if (outcome == null) {
      throw new IllegalStateException("Handler for routingKey=" + delivery.routingKey()
          + " returned no outcome");
    }
    settle(delivery, context, outcome);
    return outcome;
  }

  private void settle(Delivery delivery, DeliveryContext context, HandlerOutcome outcome)
      throws IOException {
    if (context.isSettled()) {
      return;
    }
    switch (outcome) {
      case ACK -> context.ack();
      case REJECT_REQUEUE -> requeuePolicy.requeue(delivery, context);
      case IGNORE -> logger.fine(() -> "Handler left deliveryTag=" + delivery.deliveryTag()
          + " unsettled");
    }
  }
}
