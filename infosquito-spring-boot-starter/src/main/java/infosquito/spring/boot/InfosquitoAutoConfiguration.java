package infosquito.spring.boot;

import infosquito.Infosquito;
import infosquito.InfosquitoConfig;
import infosquito.ReindexAction;
import infosquito.amqp.AmqpBrokerConnector;
import infosquito.connect.ExponentialBackoffPolicy;
import infosquito.spi.BrokerConnector;
import infosquito.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the reindexing notifier.
 *
 * <p>Active when the application defines a {@link ReindexAction} bean. Wires an
 * {@link Infosquito} composite from {@link InfosquitoProperties}, connecting through
 * {@link AmqpBrokerConnector} unless another {@link BrokerConnector} bean exists.
 *
 * @see InfosquitoProperties
 * @see InfosquitoMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Infosquito.class)
@ConditionalOnBean(ReindexAction.class)
@EnableConfigurationProperties(InfosquitoProperties.class)
public class InfosquitoAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public InfosquitoConfig infosquitoConfig(InfosquitoProperties props) {
    return props.toConfig().validate();
  }

  @Bean
  @ConditionalOnMissingBean(BrokerConnector.class)
  public AmqpBrokerConnector amqpBrokerConnector(InfosquitoConfig config, InfosquitoProperties props) {
    return new AmqpBrokerConnector(config.getAmqpUri(), props.getAmqp().getConnectionName());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Infosquito infosquito(InfosquitoProperties props,
      InfosquitoConfig config,
      BrokerConnector connector,
      ReindexAction reindexAction,
      ObjectProvider<MetricsExporter> metricsProvider) {

    InfosquitoProperties.Backoff backoff = props.getBackoff();
    var builder = Infosquito.builder()
        .connector(connector)
        .config(config)
        .reindexAction(reindexAction)
        .backoffPolicy(new ExponentialBackoffPolicy(backoff.getInitialDelay().toMillis(),
            backoff.getMaxDelay().toMillis(), backoff.getMultiplier()));
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    if (props.getReconnectDelay() != null) {
      builder.reconnectDelay(props.getReconnectDelay());
    }
    props.getAmqp().getBindingKeys().forEach(builder::bindingKey);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public InfosquitoHandlerRegistrar infosquitoHandlerRegistrar(ListableBeanFactory beanFactory,
      Infosquito infosquito) {
    return new InfosquitoHandlerRegistrar(beanFactory, infosquito);
  }

  @Bean
  @ConditionalOnMissingBean
  public InfosquitoLifecycle infosquitoLifecycle(Infosquito infosquito, InfosquitoProperties props) {
    return new InfosquitoLifecycle(infosquito, props.isAutoStartup());
  }
}
