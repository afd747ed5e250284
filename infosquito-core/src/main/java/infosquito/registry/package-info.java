/**
 * Handler routing by exact routing key.
 *
 * <p>The registry maps each routing key to a single {@link infosquito.MessageHandler}.
 * Deliveries with no matching handler are left unsettled by the dispatcher.
 *
 * @see infosquito.registry.HandlerRegistry
 * @see infosquito.registry.DefaultHandlerRegistry
 */
package infosquito.registry;
