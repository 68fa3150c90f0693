package dispatcher;

import dispatcher.util.DefaultIdGenerator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class EventTest {

    private final EventFactory factory = new EventFactory(new DefaultIdGenerator(1));

    @Test
    void factoryAssignsSequentialIdsAndDistinctCodes() {
        Event first = factory.create("Ping");
        Event second = factory.create("Ping");

        assertEquals(1, first.id());
        assertEquals(2, second.id());
        assertNotEquals(first.code(), second.code());
        assertEquals(26, first.code().length());
    }

    @Test
    void equalityUsesCodeIdAndName() {
        Event event = factory.create("Ping", Map.of("a", 1));
        Event copy = new Event(event.code(), event.id(), event.name(), Map.of("b", 2));
        Event renamed = new Event(event.code(), event.id(), "Pong", null);

        assertEquals(event, copy);
        assertEquals(event.hashCode(), copy.hashCode());
        assertTrue(event.sameAs(copy));
        assertNotEquals(event, renamed);
        assertNotEquals(event, factory.create("Ping"));
    }

    @Test
    void rejectsEmptyName() {
        assertThrows(IllegalArgumentException.class, () -> factory.create(""));
        assertThrows(NullPointerException.class, () -> factory.create(null));
    }

    @Test
    void payloadIsMutableThroughEventMethods() {
        Event event = factory.create("OrderPlaced");
        assertTrue(event.isEmpty());

        event.put("orderId", "order-1").put("total", 42);

        assertTrue(event.containsKey("orderId"));
        assertEquals(42, event.get("total"));
        assertEquals(Map.of("orderId", "order-1", "total", 42), event.data());

        assertEquals("order-1", event.remove("orderId"));
        assertFalse(event.containsKey("orderId"));

        event.clear();
        assertTrue(event.isEmpty());
    }

    @Test
    void getMissingKeyThrows() {
        Event event = factory.create("OrderPlaced");

        assertThrows(NoSuchElementException.class, () -> event.get("missing"));
    }

    @Test
    void getReturnsStoredNull() {
        Event event = factory.create("OrderPlaced").put("note", null);

        assertNull(event.get("note"));
    }

    @Test
    void dataViewIsReadOnly() {
        Event event = factory.create("OrderPlaced");

        assertThrows(UnsupportedOperationException.class, () -> event.data().put("k", "v"));
    }

    @Test
    void constructorCopiesInitialData() {
        Map<String, Object> initial = new HashMap<>();
        initial.put("k", "v");
        Event event = factory.create("OrderPlaced", initial);

        initial.put("k", "changed");

        assertEquals("v", event.get("k"));
    }

    @Test
    void lastNotifiedStartsEmpty() {
        Event event = factory.create("Ping");
        assertNull(event.lastNotified());

        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        event.markNotified(now);

        assertEquals(now, event.lastNotified());
    }

    @Test
    void builderAccumulatesData() {
        Event event = factory.builder()
            .name("UserCreated")
            .data("userId", "u-1")
            .data(Map.of("email", "a@example.com"))
            .build();

        assertEquals("UserCreated", event.name());
        assertEquals("u-1", event.get("userId"));
        assertEquals("a@example.com", event.get("email"));
    }

    @Test
    void builderRequiresName() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> factory.builder().data("k", "v").build());

        assertTrue(ex.getMessage().contains("name"));
    }

    @Test
    void defaultBuilderUsesSharedFactory() {
        Event first = Event.builder().name("Ping").build();
        Event second = Event.builder().name("Ping").build();

        assertTrue(second.id() > first.id());
    }
}
