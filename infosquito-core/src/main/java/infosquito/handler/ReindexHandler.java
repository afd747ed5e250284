package infosquito.handler;

import infosquito.Delivery;
import infosquito.DeliveryContext;
import infosquito.HandlerOutcome;
import infosquito.MessageHandler;
import infosquito.ReindexAction;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the reindex action for {@code index.all} and {@code index.data} messages.
 *
 * <p>Acknowledges the message when the action completes. Any failure, including
 * errors, is logged and answered with {@link HandlerOutcome#REJECT_REQUEUE}, so the
 * same message is retried until reindexing succeeds.
 */
public final class ReindexHandler implements MessageHandler {
  private static final Logger logger = Logger.getLogger(ReindexHandler.class.getName());

  private final ReindexAction action;

  public ReindexHandler(ReindexAction action) {
    this.action = Objects.requireNonNull(action, "action");
  }

  @Override
  public HandlerOutcome process(Delivery delivery, DeliveryContext context) {
    try {
      action.reindex();
      return HandlerOutcome.ACK;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "data store reindexing failed", t);
      return HandlerOutcome.REJECT_REQUEUE;
    }
  }
}
