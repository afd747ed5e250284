package infosquito.dispatch;

import infosquito.Delivery;
import infosquito.DeliveryContext;
import infosquito.util.Sleeper;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Requeue policy that blocks the consumer thread for the retry interval, then rejects
 * the delivery with requeue so the broker redelivers it.
 *
 * <p>While the consumer waits, no other message on the queue is processed.
 */
public final class BlockingRequeuePolicy implements RequeuePolicy {
  private static final Logger logger = Logger.getLogger(BlockingRequeuePolicy.class.getName());

  private final Duration retryInterval;
  private final Sleeper sleeper;

  public BlockingRequeuePolicy(Duration retryInterval, Sleeper sleeper) {
    Objects.requireNonNull(retryInterval, "retryInterval");
    if (retryInterval.isNegative()) {
      throw new IllegalArgumentException("retryInterval must not be negative");
    }
    this.retryInterval = retryInterval;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public Duration retryInterval() {
    return retryInterval;
  }

  @Override
  public void requeue(Delivery delivery, DeliveryContext context) throws IOException {
    logger.warning("requeuing message after " + retryInterval.toSeconds() + " seconds");
    sleeper.sleep(retryInterval);
    context.reject(true);
  }
}
