package infosquito.topology;

import infosquito.RoutingKeys;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Exchange, queue and bindings the notifier consumes from.
 *
 * <p>The queue is always durable, non-exclusive and never auto-deleted, so it survives
 * broker restarts and can be shared by several consumers.
 *
 * @see TopologySetup
 */
public final class Topology {
  public static final boolean QUEUE_DURABLE = true;
  public static final boolean QUEUE_EXCLUSIVE = false;
  public static final boolean QUEUE_AUTO_DELETE = false;

  private final String exchangeName;
  private final boolean exchangeDurable;
  private final boolean exchangeAutoDelete;
  private final String queueName;
  private final List<String> bindingKeys;

  private Topology(Builder builder) {
    this.exchangeName = requireNonBlank(builder.exchangeName, "exchangeName");
    this.queueName = requireNonBlank(builder.queueName, "queueName");
    this.exchangeDurable = builder.exchangeDurable;
    this.exchangeAutoDelete = builder.exchangeAutoDelete;
    if (builder.bindingKeys.isEmpty()) {
      throw new IllegalArgumentException("at least one binding key is required");
    }
    this.bindingKeys = Collections.unmodifiableList(new ArrayList<>(builder.bindingKeys));
  }

  public static Builder builder() {
    return new Builder();
  }

  public String exchangeName() {
    return exchangeName;
  }

  public boolean exchangeDurable() {
    return exchangeDurable;
  }

  public boolean exchangeAutoDelete() {
    return exchangeAutoDelete;
  }

  public String queueName() {
    return queueName;
  }

  /**
   * Returns the binding patterns in declaration order, without duplicates.
   *
   * @return immutable list of routing key patterns
   */
  public List<String> bindingKeys() {
    return bindingKeys;
  }

  /**
   * Returns whether a message published with {@code routingKey} reaches the queue
   * through one of its bindings, using topic exchange matching: {@code *} matches
   * exactly one word and {@code #} zero or more words.
   *
   * @param routingKey a concrete routing key
   * @return {@code true} if some binding key matches
   */
  public boolean binds(String routingKey) {
    Objects.requireNonNull(routingKey, "routingKey");
    String[] words = routingKey.split("\\.", -1);
    for (String bindingKey : bindingKeys) {
      if (matches(bindingKey.split("\\.", -1), 0, words, 0)) {
        return true;
      }
    }
    return false;
  }

  static boolean matches(String[] pattern, int p, String[] words, int w) {
    if (p == pattern.length) {
      return w == words.length;
    }
    if (pattern[p].equals("#")) {
      for (int skip = w; skip <= words.length; skip++) {
        if (matches(pattern, p + 1, words, skip)) {
          return true;
        }
      }
      return false;
    }
    if (w == words.length) {
      return false;
    }
    if (pattern[p].equals("*") || pattern[p].equals(words[w])) {
      return matches(pattern, p + 1, words, w + 1);
    }
    return false;
  }

  private static String requireNonBlank(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be blank");
    }
    return value;
  }

  @Override
  public String toString() {
    return "Topology{exchange='" + exchangeName + "', queue='" + queueName
        + "', bindings=" + bindingKeys + '}';
  }

  /** Builder for {@link Topology}. */
  public static final class Builder {
    private String exchangeName;
    private boolean exchangeDurable = true;
    private boolean exchangeAutoDelete = false;
    private String queueName;
    private final LinkedHashSet<String> bindingKeys = new LinkedHashSet<>(RoutingKeys.DEFAULT_BINDINGS);

    private Builder() {}

    /**
     * Sets the topic exchange name. <b>Required.</b>
     *
     * @param exchangeName the exchange name
     * @return this builder
     */
    public Builder exchangeName(String exchangeName) {
      this.exchangeName = exchangeName;
      return this;
    }

    /**
     * Optional. Defaults to {@code true}.
     *
     * @param exchangeDurable whether the exchange survives broker restarts
     * @return this builder
     */
    public Builder exchangeDurable(boolean exchangeDurable) {
      this.exchangeDurable = exchangeDurable;
      return this;
    }

    /**
     * Optional. Defaults to {@code false}.
     *
     * @param exchangeAutoDelete whether the exchange is deleted when unused
     * @return this builder
     */
    public Builder exchangeAutoDelete(boolean exchangeAutoDelete) {
      this.exchangeAutoDelete = exchangeAutoDelete;
      return this;
    }

    /**
     * Sets the queue the notifier consumes from. <b>Required.</b>
     *
     * @param queueName the queue name
     * @return this builder
     */
    public Builder queueName(String queueName) {
      this.queueName = queueName;
      return this;
    }

    /**
     * Adds a binding pattern on top of {@link RoutingKeys#DEFAULT_BINDINGS}.
     *
     * @param bindingKey routing key pattern
     * @return this builder
     */
    public Builder bindingKey(String bindingKey) {
      this.bindingKeys.add(Objects.requireNonNull(bindingKey, "bindingKey"));
      return this;
    }

    public Topology build() {
      return new Topology(this);
    }
  }
}
