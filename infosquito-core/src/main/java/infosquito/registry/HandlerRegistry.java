package infosquito.registry;

import infosquito.MessageHandler;

/**
 * Registry for looking up message handlers by routing key.
 *
 * <p>Lookups use the literal routing key of a delivery, compared by exact string
 * equality. Topic wildcards only apply to queue bindings, never to handler lookup.
 *
 * @see MessageHandler
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handler registered for the given routing key, or null if none is.
   *
   * @param routingKey the literal routing key of a delivery
   * @return the handler, or null if unregistered
   */
  MessageHandler handlerFor(String routingKey);
}
