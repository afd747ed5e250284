package infosquito.demo;

import infosquito.Delivery;
import infosquito.DeliveryContext;
import infosquito.HandlerOutcome;
import infosquito.MessageHandler;
import infosquito.spring.boot.InfosquitoHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@InfosquitoHandler(routingKey = "events.infosquito.status")
public class StatusEventHandler implements MessageHandler {

  private static final Logger log = LoggerFactory.getLogger(StatusEventHandler.class);

  @Override
  public HandlerOutcome process(Delivery delivery, DeliveryContext context) {
    log.info("[Handler] status event: deliveryTag={}, payload={}",
        delivery.deliveryTag(), delivery.bodyAsString());
    return HandlerOutcome.ACK;
  }
}
