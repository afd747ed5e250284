package infosquito;

/**
 * Result returned by a {@link MessageHandler} telling the dispatcher how to settle
 * the delivery.
 *
 * <ul>
 *   <li>{@link #ACK} - processing finished; the message is removed from the queue.</li>
 *   <li>{@link #REJECT_REQUEUE} - processing failed; the message goes back to the queue
 *       through the configured {@link infosquito.dispatch.RequeuePolicy}.</li>
 *   <li>{@link #IGNORE} - the delivery is left unsettled.</li>
 * </ul>
 *
 * <p>A handler that already settled the delivery through its {@link DeliveryContext}
 * may still return {@link #ACK}; the dispatcher never settles a delivery twice.
 */
public enum HandlerOutcome {
  ACK,
  REJECT_REQUEUE,
  IGNORE
}
