package infosquito.registry;

import infosquito.HandlerOutcome;
import infosquito.MessageHandler;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultHandlerRegistryTest {

  private static final MessageHandler ACK = (delivery, context) -> HandlerOutcome.ACK;

  @Test
  void looksUpByExactRoutingKey() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry().register("index.all", ACK);

    assertSame(ACK, registry.handlerFor("index.all"));
    assertNull(registry.handlerFor("index.*"));
    assertNull(registry.handlerFor("index.data"));
    assertNull(registry.handlerFor(null));
  }

  @Test
  void rejectsDuplicateRoutingKey() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry().register("index.all", ACK);

    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> registry.register("index.all", (delivery, context) -> HandlerOutcome.IGNORE));
    assertTrue(e.getMessage().contains("index.all"));
    assertSame(ACK, registry.handlerFor("index.all"));
  }

  @Test
  void rejectsNulls() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertThrows(NullPointerException.class, () -> registry.register(null, ACK));
    assertThrows(NullPointerException.class, () -> registry.register("index.all", null));
  }

  @Test
  void routingKeysIsSnapshot() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
        .register("a", ACK)
        .register("b", ACK);

    Set<String> keys = registry.routingKeys();
    registry.register("c", ACK);

    assertEquals(Set.of("a", "b"), keys);
    assertThrows(UnsupportedOperationException.class, () -> keys.add("d"));
  }
}
