package infosquito;

import java.util.List;

/**
 * Routing keys understood by the notifier.
 */
public final class RoutingKeys {

  private RoutingKeys() {}

  /** Reindex everything. */
  public static final String INDEX_ALL = "index.all";

  /** Reindex the data store. */
  public static final String INDEX_DATA = "index.data";

  /** Health check request. */
  public static final String PING = "events.infosquito.ping";

  /** Health check reply published by the notifier. */
  public static final String PONG = "events.infosquito.pong";

  /** Binding pattern covering every infosquito event. */
  public static final String EVENTS = "events.infosquito.#";

  /** Patterns the reindex queue is bound with by default. */
  public static final List<String> DEFAULT_BINDINGS = List.of(INDEX_ALL, INDEX_DATA, EVENTS);
}
