package infosquito.spring.boot;

import infosquito.Delivery;
import infosquito.DeliveryContext;
import infosquito.HandlerOutcome;
import infosquito.Infosquito;
import infosquito.InfosquitoConfig;
import infosquito.MessageHandler;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.beans.factory.ListableBeanFactory;

import static org.junit.jupiter.api.Assertions.*;

class InfosquitoHandlerRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(InfosquitoConfigBase.class);

  @Test
  void registersAnnotatedHandler() {
    runner.withUserConfiguration(StatusHandlerConfig.class).run(ctx -> {
      var infosquito = ctx.getBean(Infosquito.class);
      assertInstanceOf(StatusHandler.class,
          infosquito.handlerRegistry().handlerFor("events.infosquito.status"));
    });
  }

  @Test
  void registersHandlerForUnboundKey() {
    runner.withUserConfiguration(UnboundHandlerConfig.class).run(ctx -> {
      assertNull(ctx.getStartupFailure());
      var infosquito = ctx.getBean(Infosquito.class);
      assertNotNull(infosquito.handlerRegistry().handlerFor("index.templates"));
      assertFalse(infosquito.topology().binds("index.templates"));
    });
  }

  @Test
  void failsWhenBeanDoesNotImplementMessageHandler() {
    runner.withUserConfiguration(NotAHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenRoutingKeyIsBlank() {
    runner.withUserConfiguration(BlankKeyConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenRoutingKeyIsAlreadyHandled() {
    runner.withUserConfiguration(PingOverrideConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
      assertTrue(ctx.getStartupFailure().getMessage().contains("events.infosquito.ping"));
    });
  }

  // ── Test support ─────────────────────────────────────────────

  @Configuration
  static class InfosquitoConfigBase {
    @Bean(destroyMethod = "close")
    Infosquito infosquito() {
      return Infosquito.builder()
          .connector(new RefusingConnector())
          .config(new InfosquitoConfig())
          .reindexAction(() -> { })
          .build();
    }

    @Bean
    InfosquitoHandlerRegistrar registrar(ListableBeanFactory beanFactory, Infosquito infosquito) {
      return new InfosquitoHandlerRegistrar(beanFactory, infosquito);
    }
  }

  @InfosquitoHandler(routingKey = "events.infosquito.status")
  static class StatusHandler implements MessageHandler {
    @Override
    public HandlerOutcome process(Delivery delivery, DeliveryContext context) {
      return HandlerOutcome.ACK;
    }
  }

  @InfosquitoHandler(routingKey = "index.templates")
  static class TemplatesHandler implements MessageHandler {
    @Override
    public HandlerOutcome process(Delivery delivery, DeliveryContext context) {
      return HandlerOutcome.ACK;
    }
  }

  @InfosquitoHandler(routingKey = "events.infosquito.ping")
  static class PingOverride implements MessageHandler {
    @Override
    public HandlerOutcome process(Delivery delivery, DeliveryContext context) {
      return HandlerOutcome.IGNORE;
    }
  }

  @InfosquitoHandler(routingKey = " ")
  static class BlankKeyHandler implements MessageHandler {
    @Override
    public HandlerOutcome process(Delivery delivery, DeliveryContext context) {
      return HandlerOutcome.ACK;
    }
  }

  @InfosquitoHandler(routingKey = "index.all")
  static class NotAHandler {
  }

  @Configuration
  static class StatusHandlerConfig {
    @Bean
    StatusHandler statusHandler() {
      return new StatusHandler();
    }
  }

  @Configuration
  static class UnboundHandlerConfig {
    @Bean
    TemplatesHandler templatesHandler() {
      return new TemplatesHandler();
    }
  }

  @Configuration
  static class PingOverrideConfig {
    @Bean
    PingOverride pingOverride() {
      return new PingOverride();
    }
  }

  @Configuration
  static class BlankKeyConfig {
    @Bean
    BlankKeyHandler blankKeyHandler() {
      return new BlankKeyHandler();
    }
  }

  @Configuration
  static class NotAHandlerConfig {
    @Bean
    NotAHandler notAHandler() {
      return new NotAHandler();
    }
  }
}
