package infosquito.dispatch;

import infosquito.Delivery;
import infosquito.DeliveryContext;

import java.io.IOException;

/**
 * Decides how a delivery whose handler returned
 * {@link infosquito.HandlerOutcome#REJECT_REQUEUE} goes back to the broker.
 *
 * <p>Implementations must settle the delivery through {@code context}. The default,
 * {@link BlockingRequeuePolicy}, holds the consumer for a fixed interval before
 * rejecting with requeue; an asynchronous implementation could instead schedule a
 * delayed redelivery without changing any handler.
 *
 * @see BlockingRequeuePolicy
 */
public interface RequeuePolicy {

    /**
     * Returns the delivery to the broker for another attempt.
     *
     * @param delivery the failed delivery
     * @param context  settlement operations for the delivery
     * @throws IOException if the delivery cannot be settled
     */
    void requeue(Delivery delivery, DeliveryContext context) throws IOException;
}
