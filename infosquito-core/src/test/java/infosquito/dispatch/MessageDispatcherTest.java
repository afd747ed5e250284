package infosquito.dispatch;

import infosquito.Delivery;
import infosquito.HandlerOutcome;
import infosquito.RoutingKeys;
import infosquito.handler.PingHandler;
import infosquito.handler.ReindexHandler;
import infosquito.registry.DefaultHandlerRegistry;
import infosquito.testing.InMemoryBroker;
import infosquito.testing.RecordingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MessageDispatcherTest {

  private static final Duration RETRY = Duration.ofSeconds(60);

  private InMemoryBroker broker;
  private InMemoryBroker.InMemoryChannel channel;
  private RecordingMetrics metrics;
  private AtomicInteger reindexCalls;
  private volatile boolean reindexFails;
  private MessageDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    broker = new InMemoryBroker();
    channel = broker.newChannel();
    metrics = new RecordingMetrics();
    reindexCalls = new AtomicInteger();
    ReindexHandler reindex = new ReindexHandler(() -> {
      reindexCalls.incrementAndGet();
      if (reindexFails) {
        throw new IllegalStateException("elasticsearch unavailable");
      }
    });
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register(RoutingKeys.INDEX_ALL, reindex)
        .register(RoutingKeys.INDEX_DATA, reindex)
        .register(RoutingKeys.PING, new PingHandler(metrics));
    dispatcher = new MessageDispatcher(registry,
        new BlockingRequeuePolicy(RETRY, broker.sleeper()), "de", metrics);
  }

  private static Delivery delivery(long tag, String routingKey) {
    return new Delivery(tag, routingKey, "{}".getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void indexAllTriggersOneReindexAndOneAck() throws Exception {
    HandlerOutcome outcome = dispatcher.route(delivery(7, "index.all"), channel);

    assertEquals(HandlerOutcome.ACK, outcome);
    assertEquals(1, reindexCalls.get());
    assertEquals(List.of("ack:7"), broker.events());
    assertEquals(1, metrics.acked.get());
  }

  @Test
  void indexDataTriggersOneReindexAndOneAck() throws Exception {
    dispatcher.route(delivery(8, "index.data"), channel);

    assertEquals(1, reindexCalls.get());
    assertEquals(List.of("ack:8"), broker.events());
  }

  @Test
  void failedReindexWaitsRetryIntervalThenRequeues() throws Exception {
    reindexFails = true;

    HandlerOutcome outcome = dispatcher.route(delivery(9, "index.data"), channel);

    assertEquals(HandlerOutcome.REJECT_REQUEUE, outcome);
    assertEquals(List.of("sleep:60000", "reject:9:requeue=true"), broker.events());
    assertEquals(0, broker.count("ack:"));
    assertEquals(1, metrics.requeued.get());
    assertEquals(0, metrics.acked.get());
  }

  @Test
  void unknownRoutingKeyIsLeftUnsettled() throws Exception {
    HandlerOutcome outcome = dispatcher.route(delivery(10, "index.templates"), channel);

    assertEquals(HandlerOutcome.IGNORE, outcome);
    assertEquals(0, reindexCalls.get());
    assertTrue(broker.events().isEmpty());
    assertEquals(1, metrics.unhandled.get());
  }

  @Test
  void otherEventsAreLeftUnsettled() throws Exception {
    dispatcher.route(delivery(11, "events.infosquito.status"), channel);

    assertTrue(broker.events().isEmpty());
    assertTrue(broker.published().isEmpty());
  }

  @Test
  void pingIsAckedOnceBeforePong() throws Exception {
    HandlerOutcome outcome = dispatcher.route(delivery(12, RoutingKeys.PING), channel);

    assertEquals(HandlerOutcome.ACK, outcome);
    assertEquals(List.of("ack:12", "publish:de:events.infosquito.pong"), broker.events());
    assertEquals(0, reindexCalls.get());
  }

  @Test
  void handlerReturningNullIsAnError() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("broken", (delivery, context) -> null);
    MessageDispatcher broken = new MessageDispatcher(registry,
        new BlockingRequeuePolicy(RETRY, broker.sleeper()), "de", metrics);

    assertThrows(IllegalStateException.class, () -> broken.route(delivery(13, "broken"), channel));
    assertTrue(broker.events().isEmpty());
  }

  @Test
  void handlerExceptionPropagatesWithoutSettlement() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("boom", (delivery, context) -> {
          throw new IOException("downstream gone");
        });
    MessageDispatcher failing = new MessageDispatcher(registry,
        new BlockingRequeuePolicy(RETRY, broker.sleeper()), "de", metrics);

    assertThrows(IOException.class, () -> failing.route(delivery(14, "boom"), channel));
    assertTrue(broker.events().isEmpty());
  }

  @Test
  void ignoreOutcomeLeavesDeliveryUnsettled() throws Exception {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("custom", (delivery, context) -> HandlerOutcome.IGNORE);
    MessageDispatcher custom = new MessageDispatcher(registry,
        new BlockingRequeuePolicy(RETRY, broker.sleeper()), "de", metrics);

    assertEquals(HandlerOutcome.IGNORE, custom.route(delivery(15, "custom"), channel));
    assertTrue(broker.events().isEmpty());
    assertEquals(0, metrics.unhandled.get());
  }
}
