package infosquito.topology;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopologyTest {

  @Test
  void defaultsToDurableExchangeAndThreeBindings() {
    Topology topology = Topology.builder().exchangeName("de").queueName("infosquito.reindex").build();

    assertTrue(topology.exchangeDurable());
    assertFalse(topology.exchangeAutoDelete());
    assertEquals(List.of("index.all", "index.data", "events.infosquito.#"), topology.bindingKeys());
  }

  @Test
  void duplicateBindingKeysAreCollapsed() {
    Topology topology = Topology.builder()
        .exchangeName("de")
        .queueName("q")
        .bindingKey("index.data")
        .bindingKey("index.extra")
        .bindingKey("index.extra")
        .build();

    assertEquals(List.of("index.all", "index.data", "events.infosquito.#", "index.extra"),
        topology.bindingKeys());
  }

  @Test
  void bindingKeysAreImmutable() {
    Topology topology = Topology.builder().exchangeName("de").queueName("q").build();

    assertThrows(UnsupportedOperationException.class, () -> topology.bindingKeys().add("x"));
  }

  @Test
  void rejectsMissingOrBlankNames() {
    assertThrows(NullPointerException.class, () -> Topology.builder().queueName("q").build());
    assertThrows(NullPointerException.class, () -> Topology.builder().exchangeName("de").build());
    assertThrows(IllegalArgumentException.class,
        () -> Topology.builder().exchangeName(" ").queueName("q").build());
    assertThrows(IllegalArgumentException.class,
        () -> Topology.builder().exchangeName("de").queueName("").build());
  }

  @Test
  void bindsUsesTopicMatching() {
    Topology topology = Topology.builder()
        .exchangeName("de")
        .queueName("q")
        .bindingKey("data.*.changed")
        .build();

    assertTrue(topology.binds("index.all"));
    assertTrue(topology.binds("index.data"));
    assertFalse(topology.binds("index.templates"));
    assertTrue(topology.binds("events.infosquito.ping"));
    assertTrue(topology.binds("events.infosquito"));
    assertTrue(topology.binds("events.infosquito.a.b"));
    assertFalse(topology.binds("events.other.ping"));
    assertTrue(topology.binds("data.users.changed"));
    assertFalse(topology.binds("data.changed"));
    assertFalse(topology.binds("data.a.b.changed"));
  }
}
