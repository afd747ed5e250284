package infosquito;

/**
 * Handler invoked for every delivery whose routing key it is registered for.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run <b>synchronously</b> on the single subscription thread. A handler
 * that blocks holds up every message queued behind the one it is processing.
 *
 * <h2>Error Handling</h2>
 * <p>Handlers that want the message redelivered return
 * {@link HandlerOutcome#REJECT_REQUEUE}. An exception thrown out of
 * {@link #process} is not handled by the dispatcher: it ends the subscription,
 * and the supervisor tears down the channel and connection and reconnects.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * registry.register("events.infosquito.status", (delivery, context) -> {
 *   statusLog.record(delivery.bodyAsString());
 *   return HandlerOutcome.ACK;
 * });
 * }</pre>
 *
 * @see infosquito.registry.HandlerRegistry
 * @see DeliveryContext
 */
@FunctionalInterface
public interface MessageHandler {

  /**
   * Processes one delivery.
   *
   * @param delivery the delivered message
   * @param context  settlement and publishing operations bound to the delivering channel
   * @return how the dispatcher should settle the delivery
   * @throws Exception to abandon the current subscription
   */
  HandlerOutcome process(Delivery delivery, DeliveryContext context) throws Exception;
}
