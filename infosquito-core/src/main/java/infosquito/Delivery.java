package infosquito;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single message handed to the consumer by the broker.
 *
 * <p>The {@code deliveryTag} is an opaque handle valid only on the channel that
 * delivered the message; it is used to acknowledge or reject it.
 */
public final class Delivery {
  private final long deliveryTag;
  private final String routingKey;
  private final byte[] body;

  public Delivery(long deliveryTag, String routingKey, byte[] body) {
    this.deliveryTag = deliveryTag;
    this.routingKey = Objects.requireNonNull(routingKey, "routingKey");
    this.body = body == null ? new byte[0] : body.clone();
  }

  public long deliveryTag() {
    return deliveryTag;
  }

  public String routingKey() {
    return routingKey;
  }

  /**
   * Returns a copy of the raw message body.
   *
   * @return the body bytes, never {@code null}
   */
  public byte[] body() {
    return body.clone();
  }

  /**
   * Decodes the body as UTF-8 text.
   *
   * @return the body as a string
   */
  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Delivery)) return false;
    Delivery that = (Delivery) o;
    return deliveryTag == that.deliveryTag
        && routingKey.equals(that.routingKey)
        && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(deliveryTag, routingKey);
    return 31 * result + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "Delivery{deliveryTag=" + deliveryTag + ", routingKey='" + routingKey
        + "', bodyLength=" + body.length + '}';
  }
}
