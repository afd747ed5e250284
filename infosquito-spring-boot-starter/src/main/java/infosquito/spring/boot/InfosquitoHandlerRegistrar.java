package infosquito.spring.boot;

import infosquito.Infosquito;
import infosquito.MessageHandler;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link InfosquitoHandler} and registers them with the
 * {@link Infosquito} handler registry.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * before the subscription loop is started.
 *
 * @see InfosquitoHandler
 */
public class InfosquitoHandlerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(InfosquitoHandlerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final Infosquito infosquito;

    public InfosquitoHandlerRegistrar(ListableBeanFactory beanFactory, Infosquito infosquito) {
        this.beanFactory = beanFactory;
        this.infosquito = infosquito;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(InfosquitoHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof MessageHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @InfosquitoHandler must implement MessageHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            InfosquitoHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), InfosquitoHandler.class);
            if (annotation == null) {
                annotation = beanFactory.findAnnotationOnBean(beanName, InfosquitoHandler.class);
            }
            if (annotation == null || annotation.routingKey().isBlank()) {
                throw new BeanCreationException(beanName,
                        "@InfosquitoHandler on " + bean.getClass().getName() + " must specify a routingKey");
            }

            String routingKey = annotation.routingKey();
            try {
                infosquito.handlerRegistry().register(routingKey, handler);
            } catch (IllegalStateException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
            if (!infosquito.topology().binds(routingKey)) {
                logger.warning("No binding of queue " + infosquito.topology().queueName()
                        + " matches routingKey=" + routingKey + "; handler " + beanName
                        + " will not receive messages unless the key is added to infosquito.amqp.binding-keys");
            }
        }
    }
}
