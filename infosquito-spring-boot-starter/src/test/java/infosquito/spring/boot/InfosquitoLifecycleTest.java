package infosquito.spring.boot;

import infosquito.Infosquito;
import infosquito.InfosquitoConfig;
import infosquito.connect.ExponentialBackoffPolicy;
import infosquito.spi.BrokerConnector;
import infosquito.util.Sleeper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class InfosquitoLifecycleTest {

  private static Infosquito infosquito(BrokerConnector connector) {
    return Infosquito.builder()
        .connector(connector)
        .config(new InfosquitoConfig())
        .reindexAction(() -> { })
        .backoffPolicy(new ExponentialBackoffPolicy(10, 10, 1))
        .sleeper(Sleeper.threadSleep())
        .build();
  }

  @Test
  void notRunningBeforeStart() {
    InfosquitoLifecycle lifecycle = new InfosquitoLifecycle(infosquito(new RefusingConnector()), false);

    assertFalse(lifecycle.isRunning());
    assertFalse(lifecycle.isAutoStartup());
    lifecycle.stop();
  }

  @Test
  void followsCompositeWhenClosedDirectly() {
    Infosquito infosquito = infosquito(new RefusingConnector());
    InfosquitoLifecycle lifecycle = new InfosquitoLifecycle(infosquito, true);

    lifecycle.start();
    assertTrue(lifecycle.isRunning());

    infosquito.close();

    assertFalse(lifecycle.isRunning());
    lifecycle.stop();
  }

  @Test
  void deadLoopThreadIsReportedAsStopped() throws Exception {
    BrokerConnector fatal = uri -> {
      throw new OutOfMemoryError("Java heap space");
    };
    InfosquitoLifecycle lifecycle = new InfosquitoLifecycle(infosquito(fatal), true);

    lifecycle.start();
    while (lifecycle.isRunning()) {
      Thread.sleep(10);
    }

    assertFalse(lifecycle.isRunning());
    lifecycle.stop();
  }
}
