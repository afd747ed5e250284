package infosquito.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a handler for one exact routing key.
 *
 * <p>The annotated bean must implement {@link infosquito.MessageHandler}.
 *
 * <pre>{@code
 * @Component
 * @InfosquitoHandler(routingKey = "events.infosquito.status")
 * public class StatusHandler implements MessageHandler {
 *   public HandlerOutcome process(Delivery delivery, DeliveryContext context) { ... }
 * }
 * }</pre>
 *
 * <p>The routing key must reach the queue through a binding; keys outside
 * {@code index.all}, {@code index.data} and {@code events.infosquito.#} need an
 * entry in {@code infosquito.amqp.binding-keys}.
 *
 * @see InfosquitoHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface InfosquitoHandler {

    /**
     * Routing key handled by the bean.
     */
    String routingKey();
}
