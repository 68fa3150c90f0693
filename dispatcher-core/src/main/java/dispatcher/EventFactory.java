package dispatcher;

import dispatcher.spi.IdGenerator;
import dispatcher.util.DefaultIdGenerator;

import java.util.Map;
import java.util.Objects;

/**
 * Creates {@link Event} instances with ids and codes from an {@link IdGenerator}.
 */
public final class EventFactory {
    private static final EventFactory DEFAULT = new EventFactory(DefaultIdGenerator.shared());

    private final IdGenerator idGenerator;

    public EventFactory(IdGenerator idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Returns the factory backed by the process-wide {@link DefaultIdGenerator}.
     *
     * @return the default factory
     */
    public static EventFactory defaultFactory() {
        return DEFAULT;
    }

    public Event create(String name) {
        return create(name, null);
    }

    /**
     * Creates an event with the next id, a fresh code, and a copy of {@code data}.
     *
     * @param name the event name
     * @param data initial payload, may be null
     * @return a new event
     */
    public Event create(String name, Map<String, Object> data) {
        return new Event(idGenerator.nextCode(), idGenerator.nextId(), name, data);
    }

    public Event.Builder builder() {
        return new Event.Builder(this);
    }
}
