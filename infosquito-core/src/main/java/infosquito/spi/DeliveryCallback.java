package infosquito.spi;

import infosquito.Delivery;

/**
 * Receives deliveries from {@link BrokerChannel#consume}.
 */
@FunctionalInterface
public interface DeliveryCallback {

    /**
     * Handles one delivery.
     *
     * @param delivery the delivered message
     * @throws Exception to end the subscription
     */
    void handle(Delivery delivery) throws Exception;
}
