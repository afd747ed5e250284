package infosquito.registry;

import infosquito.MessageHandler;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry mapping each routing key to exactly one handler.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register(RoutingKeys.INDEX_ALL, reindexHandler)
 *     .register(RoutingKeys.INDEX_DATA, reindexHandler)
 *     .register(RoutingKeys.PING, pingHandler);
 * }</pre>
 *
 * <p>The same handler may serve several routing keys, but a routing key cannot be
 * registered twice.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {

  private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers a handler for a routing key.
   *
   * @param routingKey the exact routing key
   * @param handler    the handler
   * @return this registry for chaining
   * @throws IllegalStateException if a handler is already registered for {@code routingKey}
   */
  public DefaultHandlerRegistry register(String routingKey, MessageHandler handler) {
    Objects.requireNonNull(routingKey, "routingKey");
    Objects.requireNonNull(handler, "handler");
    MessageHandler existing = handlers.putIfAbsent(routingKey, handler);
    if (existing != null) {
      throw new IllegalStateException("Duplicate handler for routingKey=" + routingKey);
    }
    return this;
  }

  @Override
  public MessageHandler handlerFor(String routingKey) {
    if (routingKey == null) {
      return null;
    }
    return handlers.get(routingKey);
  }

  /**
   * Returns the routing keys that currently have a handler.
   *
   * @return unmodifiable snapshot of registered routing keys
   */
  public Set<String> routingKeys() {
    return Collections.unmodifiableSet(Set.copyOf(handlers.keySet()));
  }
}
